package com.cscript.compiler.lowering;

import java.util.List;

import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.SourceToken.TokenType;
import com.cscript.compiler.lexer.TokenScanner;

/**
 * {@code @unsafe { B }} becomes {@code { CS_UNSAFE_BEGIN; B CS_UNSAFE_END; }}.
 * The prelude macros relax the conversion warnings that hardline turns into
 * errors for the statements of the block. Blocks may nest.
 */
public class UnsafeBlockRule extends TokenRewriteRule {

    static final String KEYWORD = "unsafe";

    @Override
    public String name() {
        return "unsafe-block";
    }

    @Override
    protected int rewriteAt(List<SourceToken> tokens, int index, StringBuilder out, LoweringContext context) {
        if (!tokens.get(index).isPunctuation("@") || index + 1 >= tokens.size()
                || !tokens.get(index + 1).isIdentifier(KEYWORD)) {
            return -1;
        }
        int open = TokenScanner.nextSignificant(tokens, index + 2);
        if (!tokens.get(open).isPunctuation("{")) {
            return -1;
        }
        int close = TokenScanner.findClosing(tokens, open);
        if (close < 0 || !tokens.get(close).isPunctuation("}")) {
            return -1;
        }

        String header = TokenScanner.text(tokens, index, open + 1);
        String body = apply(TokenScanner.text(tokens, open + 1, close), context);
        out.append(alignLines(header, "{ CS_UNSAFE_BEGIN;", tokens.get(open + 1).getLine()));
        if (!tokens.get(open + 1).is(TokenType.WHITESPACE)) {
            out.append(' ');
        }
        out.append(body);
        if (close - 1 > open && !tokens.get(close - 1).is(TokenType.WHITESPACE)) {
            out.append(' ');
        }
        out.append("CS_UNSAFE_END; }");
        return close + 1;
    }
}
