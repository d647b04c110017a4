package com.cscript.compiler.lowering;

import java.util.List;

import com.cscript.compiler.lexer.SourceLexer;
import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.TokenScanner;

/**
 * Base for rules that scan the token stream and replace recognized spans.
 * Every token not consumed by a rewrite is copied through byte for byte.
 */
public abstract class TokenRewriteRule implements LoweringRule {

    @Override
    public String apply(String text, LoweringContext context) {
        List<SourceToken> tokens = SourceLexer.tokenize(text);
        StringBuilder out = new StringBuilder(text.length() + text.length() / 8);

        int i = 0;
        int last = tokens.size() - 1;
        while (i < last) {
            int next = rewriteAt(tokens, i, out, context);
            if (next > i) {
                context.recordRewrite(name());
                i = next;
            } else {
                out.append(tokens.get(i).getText());
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Attempts a rewrite starting at token {@code index}. On success appends the
     * replacement to {@code out} and returns the index of the first token after
     * the consumed span; otherwise appends nothing and returns -1.
     */
    protected abstract int rewriteAt(List<SourceToken> tokens, int index, StringBuilder out, LoweringContext context);

    /**
     * Keeps the lines that follow a rewritten span where they were. A
     * replacement with fewer newlines than the original is padded; one with
     * more is followed by a {@code #line} directive naming the original line
     * of the next token.
     */
    protected static String alignLines(String original, String replacement, int nextLine) {
        int missing = TokenScanner.countNewlines(original) - TokenScanner.countNewlines(replacement);
        if (missing > 0) {
            return replacement + "\n".repeat(missing);
        }
        if (missing < 0) {
            return replacement + "\n#line " + nextLine + "\n";
        }
        return replacement;
    }
}
