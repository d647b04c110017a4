package com.cscript.compiler.lexer;

import java.util.List;

import com.cscript.compiler.lexer.SourceToken.TokenType;

/**
 * Navigation helpers over a token list produced by {@link SourceLexer}.
 */
public final class TokenScanner {

    private TokenScanner() {
        // Utility class
    }

    /**
     * Index of the first non-trivia token at or after {@code from}; the EOF index when none.
     */
    public static int nextSignificant(List<SourceToken> tokens, int from) {
        int i = from;
        while (i < tokens.size() - 1 && tokens.get(i).isTrivia()) {
            i++;
        }
        return Math.min(i, tokens.size() - 1);
    }

    /**
     * Index of the last non-trivia token strictly before {@code from}, or -1.
     */
    public static int previousSignificant(List<SourceToken> tokens, int from) {
        int i = from - 1;
        while (i >= 0 && tokens.get(i).isTrivia()) {
            i--;
        }
        return i;
    }

    /**
     * Finds the delimiter closing the one at {@code openIndex}, counting all
     * bracket kinds together. Returns -1 when the text is unbalanced.
     */
    public static int findClosing(List<SourceToken> tokens, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            SourceToken token = tokens.get(i);
            if (token.is(TokenType.PUNCTUATION)) {
                if (isOpening(token)) {
                    depth++;
                } else if (isClosing(token)) {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                    if (depth < 0) {
                        return -1;
                    }
                }
            }
        }
        return -1;
    }

    /**
     * Finds the first punctuation token equal to {@code value} at bracket depth
     * zero in {@code [from, to)}. Returns -1 when absent or when a closing
     * bracket leaves the starting depth first.
     */
    public static int findAtDepthZero(List<SourceToken> tokens, int from, int to, String value) {
        int depth = 0;
        for (int i = from; i < to && i < tokens.size(); i++) {
            SourceToken token = tokens.get(i);
            if (!token.is(TokenType.PUNCTUATION)) {
                continue;
            }
            if (depth == 0 && token.getText().equals(value)) {
                return i;
            }
            if (isOpening(token)) {
                depth++;
            } else if (isClosing(token)) {
                depth--;
                if (depth < 0) {
                    return -1;
                }
            }
        }
        return -1;
    }

    /**
     * Concatenated text of tokens {@code [from, to)}.
     */
    public static String text(List<SourceToken> tokens, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to && i < tokens.size(); i++) {
            sb.append(tokens.get(i).getText());
        }
        return sb.toString();
    }

    public static boolean isOpening(SourceToken token) {
        return token.isPunctuation("(") || token.isPunctuation("[") || token.isPunctuation("{");
    }

    public static boolean isClosing(SourceToken token) {
        return token.isPunctuation(")") || token.isPunctuation("]") || token.isPunctuation("}");
    }

    public static int countNewlines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
