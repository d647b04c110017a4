package com.cscript.compiler.lowering;

import java.util.List;

import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.SourceToken.TokenType;
import com.cscript.compiler.lexer.TokenScanner;

import lombok.Value;

/**
 * The common {@code fn N(P) ->} prefix of both function forms. Parameters are
 * kept as an opaque span.
 */
@Value
class FunctionHead {
    String name;
    String parameters;
    /** Index of the first token after {@code ->}. */
    int typeStart;

    /**
     * Returns null when the tokens at {@code fnIndex} are not a function head.
     */
    static FunctionHead parse(List<SourceToken> tokens, int fnIndex) {
        if (!tokens.get(fnIndex).isSugar("fn")) {
            return null;
        }

        int nameIndex = TokenScanner.nextSignificant(tokens, fnIndex + 1);
        if (!tokens.get(nameIndex).is(TokenType.IDENTIFIER)) {
            return null;
        }

        int open = TokenScanner.nextSignificant(tokens, nameIndex + 1);
        if (!tokens.get(open).isPunctuation("(")) {
            return null;
        }

        int close = TokenScanner.findClosing(tokens, open);
        if (close < 0 || !tokens.get(close).isPunctuation(")")) {
            return null;
        }

        int arrow = TokenScanner.nextSignificant(tokens, close + 1);
        if (!tokens.get(arrow).isPunctuation("->")) {
            return null;
        }

        return new FunctionHead(tokens.get(nameIndex).getText(),
                TokenScanner.text(tokens, open + 1, close), arrow + 1);
    }
}
