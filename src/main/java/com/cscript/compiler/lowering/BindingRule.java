package com.cscript.compiler.lowering;

import java.util.List;

import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.SourceToken.TokenType;

/**
 * {@code let T x} becomes {@code const T x}; {@code var T x} becomes {@code T x}.
 * Only applies when the keyword is followed by whitespace and an identifier.
 */
public class BindingRule extends TokenRewriteRule {

    @Override
    public String name() {
        return "binding";
    }

    @Override
    protected int rewriteAt(List<SourceToken> tokens, int index, StringBuilder out, LoweringContext context) {
        SourceToken keyword = tokens.get(index);
        if (!keyword.isSugar("let") && !keyword.isSugar("var")) {
            return -1;
        }
        if (index + 2 >= tokens.size()) {
            return -1;
        }

        SourceToken gap = tokens.get(index + 1);
        if (!gap.is(TokenType.WHITESPACE) || !tokens.get(index + 2).is(TokenType.IDENTIFIER)) {
            return -1;
        }

        if (keyword.isSugar("let")) {
            out.append("const").append(gap.getText());
        } else {
            int newline = gap.getText().indexOf('\n');
            if (newline >= 0) {
                out.append(gap.getText().substring(newline));
            }
        }
        return index + 2;
    }
}
