package com.cscript.compiler.lowering;

import java.util.List;

import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.SourceToken.TokenType;
import com.cscript.compiler.lexer.TokenScanner;

/**
 * {@code fn N(P) -> T {...}} becomes {@code T N(P){...}}; only the header is rewritten.
 */
public class BlockFunctionRule extends TokenRewriteRule {

    @Override
    public String name() {
        return "block-function";
    }

    @Override
    protected int rewriteAt(List<SourceToken> tokens, int index, StringBuilder out, LoweringContext context) {
        FunctionHead head = FunctionHead.parse(tokens, index);
        if (head == null) {
            return -1;
        }

        int brace = -1;
        for (int i = head.getTypeStart(); i < tokens.size(); i++) {
            SourceToken token = tokens.get(i);
            if (token.isPunctuation("{")) {
                brace = i;
                break;
            }
            if (token.is(TokenType.EOF) || token.isPunctuation(";") || token.isPunctuation("=>")
                    || token.isPunctuation("}") || token.isPunctuation("=")) {
                return -1;
            }
        }
        if (brace < 0) {
            return -1;
        }

        String returnType = TokenScanner.text(tokens, head.getTypeStart(), brace).strip();
        if (returnType.isEmpty()) {
            return -1;
        }

        String replacement = returnType + " " + head.getName() + "(" + head.getParameters() + "){";
        String original = TokenScanner.text(tokens, index, brace + 1);
        out.append(alignLines(original, replacement, tokens.get(brace + 1).getLine()));
        return brace + 1;
    }
}
