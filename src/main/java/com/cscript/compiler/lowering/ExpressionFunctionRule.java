package com.cscript.compiler.lowering;

import java.util.List;

import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.SourceToken.TokenType;
import com.cscript.compiler.lexer.TokenScanner;

/**
 * {@code fn N(P) -> T => E;} becomes {@code static inline T N(P){ return (E); }}.
 */
public class ExpressionFunctionRule extends TokenRewriteRule {

    @Override
    public String name() {
        return "expression-function";
    }

    @Override
    protected int rewriteAt(List<SourceToken> tokens, int index, StringBuilder out, LoweringContext context) {
        FunctionHead head = FunctionHead.parse(tokens, index);
        if (head == null) {
            return -1;
        }

        int arrow = -1;
        for (int i = head.getTypeStart(); i < tokens.size(); i++) {
            SourceToken token = tokens.get(i);
            if (token.isPunctuation("=>")) {
                arrow = i;
                break;
            }
            if (token.is(TokenType.EOF) || token.isPunctuation("{") || token.isPunctuation("}")
                    || token.isPunctuation(";")) {
                return -1;
            }
        }
        if (arrow < 0) {
            return -1;
        }

        int semicolon = TokenScanner.findAtDepthZero(tokens, arrow + 1, tokens.size(), ";");
        if (semicolon < 0) {
            return -1;
        }

        String returnType = TokenScanner.text(tokens, head.getTypeStart(), arrow).strip();
        String expression = TokenScanner.text(tokens, arrow + 1, semicolon).strip();
        if (returnType.isEmpty() || expression.isEmpty()) {
            return -1;
        }

        String replacement = "static inline " + returnType + " " + head.getName()
                + "(" + head.getParameters() + "){ return (" + expression + "); }";
        String original = TokenScanner.text(tokens, index, semicolon + 1);
        out.append(alignLines(original, replacement, tokens.get(semicolon + 1).getLine()));
        return semicolon + 1;
    }
}
