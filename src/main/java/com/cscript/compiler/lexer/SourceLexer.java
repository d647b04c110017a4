package com.cscript.compiler.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.lexer.SourceToken.TokenType;

/**
 * Minimal lossless lexer for C-Script and C text.
 *
 * It only classifies spans; it never rejects input. String and character
 * literals, comments and preprocessor lines are kept as single opaque tokens
 * so that no rewrite rule can match inside them. Line numbers honour
 * {@code #line N} directives, so tokens of lowered text still report the
 * line they came from in the original unit.
 */
public class SourceLexer {
    private static final Logger log = LoggerFactory.getLogger(SourceLexer.class);

    private static final Set<String> SUGAR_WORDS = Set.of("fn", "let", "var", "match");

    private static final Set<String> BANG_SUGAR_WORDS = Set.of("enum", "enum_flags");

    private static final Set<String> TWO_CHAR_PUNCTUATION = Set.of(
        "->", "=>", "++", "--", "==", "!=", "<=", ">=", "&&", "||", "<<", ">>",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "::", "##"
    );

    private static final Pattern LINE_DIRECTIVE = Pattern.compile("^#\\s*line\\s+(\\d+)");

    private final String source;
    private int pos = 0;
    private int line = 1;
    private boolean atLineStart = true;
    private Integer pendingLine;

    public SourceLexer(String source) {
        this.source = source;
    }

    public static List<SourceToken> tokenize(String source) {
        return new SourceLexer(source).tokenize();
    }

    /**
     * Tokenize the entire text. The returned list always ends with an EOF token.
     */
    public List<SourceToken> tokenize() {
        List<SourceToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            tokens.add(nextToken());
        }

        tokens.add(new SourceToken(TokenType.EOF, "", pos, line));
        log.trace("Lexed {} tokens over {} characters", tokens.size(), source.length());
        return tokens;
    }

    private SourceToken nextToken() {
        char c = source.charAt(pos);
        int start = pos;
        int startLine = line;

        if (Character.isWhitespace(c)) {
            return readWhitespace(start, startLine);
        }

        if (c == '#' && atLineStart) {
            return readPreprocessor(start, startLine);
        }
        atLineStart = false;

        if (c == '/' && peekAt(pos + 1) == '/') {
            while (pos < source.length() && source.charAt(pos) != '\n') {
                pos++;
            }
            return token(TokenType.COMMENT, start, startLine);
        }

        if (c == '/' && peekAt(pos + 1) == '*') {
            return readBlockComment(start, startLine);
        }

        if (c == '"') {
            return readQuoted('"', TokenType.STRING_LITERAL, start, startLine);
        }

        if (c == '\'') {
            return readQuoted('\'', TokenType.CHAR_LITERAL, start, startLine);
        }

        if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekAt(pos + 1)))) {
            return readNumber(start, startLine);
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrSugar(start, startLine);
        }

        if (pos + 1 < source.length() && TWO_CHAR_PUNCTUATION.contains(source.substring(pos, pos + 2))) {
            pos += 2;
            return token(TokenType.PUNCTUATION, start, startLine);
        }

        pos++;
        return token(TokenType.PUNCTUATION, start, startLine);
    }

    private SourceToken readWhitespace(int start, int startLine) {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            if (source.charAt(pos) == '\n') {
                newLine();
            }
            pos++;
        }
        return token(TokenType.WHITESPACE, start, startLine);
    }

    private SourceToken readPreprocessor(int start, int startLine) {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                if (pos > start && source.charAt(pos - 1) == '\\') {
                    line++;
                    pos++;
                    continue;
                }
                if (pos > start + 1 && source.charAt(pos - 1) == '\r' && source.charAt(pos - 2) == '\\') {
                    line++;
                    pos++;
                    continue;
                }
                break;
            }
            pos++;
        }

        String text = source.substring(start, pos);
        Matcher matcher = LINE_DIRECTIVE.matcher(text);
        if (matcher.find()) {
            pendingLine = Integer.parseInt(matcher.group(1));
        }
        atLineStart = false;
        return new SourceToken(TokenType.PREPROCESSOR, text, start, startLine);
    }

    private SourceToken readBlockComment(int start, int startLine) {
        pos += 2;
        while (pos < source.length()) {
            if (source.charAt(pos) == '*' && peekAt(pos + 1) == '/') {
                pos += 2;
                return token(TokenType.COMMENT, start, startLine);
            }
            if (source.charAt(pos) == '\n') {
                line++;
            }
            pos++;
        }
        // Unterminated comment runs to the end of the text.
        return token(TokenType.COMMENT, start, startLine);
    }

    private SourceToken readQuoted(char quote, TokenType type, int start, int startLine) {
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                if (source.charAt(pos + 1) == '\n') {
                    line++;
                }
                pos += 2;
                continue;
            }
            if (c == '\n') {
                break; // Unterminated literal
            }
            pos++;
            if (c == quote) {
                break;
            }
        }
        return token(type, start, startLine);
    }

    private SourceToken readNumber(int start, int startLine) {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '.' || c == '_') {
                pos++;
            } else if ((c == '+' || c == '-') && "eEpP".indexOf(source.charAt(pos - 1)) >= 0) {
                pos++;
            } else {
                break;
            }
        }
        return token(TokenType.NUMBER, start, startLine);
    }

    private SourceToken readIdentifierOrSugar(int start, int startLine) {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                pos++;
            } else {
                break;
            }
        }

        String word = source.substring(start, pos);
        if (BANG_SUGAR_WORDS.contains(word) && peekAt(pos) == '!' && peekAt(pos + 1) != '=') {
            pos++;
            return token(TokenType.SUGAR_KEYWORD, start, startLine);
        }
        if (SUGAR_WORDS.contains(word)) {
            return token(TokenType.SUGAR_KEYWORD, start, startLine);
        }
        return token(TokenType.IDENTIFIER, start, startLine);
    }

    private void newLine() {
        line = pendingLine != null ? pendingLine : line + 1;
        pendingLine = null;
        atLineStart = true;
    }

    private char peekAt(int index) {
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private SourceToken token(TokenType type, int start, int startLine) {
        return new SourceToken(type, source.substring(start, pos), start, startLine);
    }
}
