package com.cscript.compiler.lexer;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A span of C-Script source text. Concatenating the text of every token of a
 * unit reproduces the unit exactly.
 */
@Data
@AllArgsConstructor
public class SourceToken {
    private TokenType type;
    private String text;
    private int offset;
    private int line;

    public enum TokenType {
        SUGAR_KEYWORD,
        IDENTIFIER,
        NUMBER,
        STRING_LITERAL,
        CHAR_LITERAL,
        COMMENT,
        PREPROCESSOR,
        WHITESPACE,
        PUNCTUATION,
        EOF
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isPunctuation(String value) {
        return type == TokenType.PUNCTUATION && text.equals(value);
    }

    public boolean isIdentifier(String value) {
        return type == TokenType.IDENTIFIER && text.equals(value);
    }

    public boolean isSugar(String value) {
        return type == TokenType.SUGAR_KEYWORD && text.equals(value);
    }

    /**
     * Whitespace and comments carry no meaning for the rewrite rules.
     */
    public boolean isTrivia() {
        return type == TokenType.WHITESPACE || type == TokenType.COMMENT;
    }

    public int endOffset() {
        return offset + text.length();
    }
}
