package com.cscript.compiler.lowering;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.TokenScanner;

import lombok.Value;

/**
 * Lowers {@code match (S) { P => B; ... }} into a block that evaluates S once
 * into {@code cs__match_K} and selects an arm with an if/else-if chain.
 *
 * <p>Text that does not parse as a match (missing braces, an arm without
 * {@code =>}, a wildcard that is not the last arm) is left as it is and the
 * C compiler reports it.
 */
public class MatchRule extends TokenRewriteRule {

    private static final Logger log = LoggerFactory.getLogger(MatchRule.class);

    static final String CACHED_PREFIX = "cs__match_";

    @Override
    public String name() {
        return "match";
    }

    @Override
    protected int rewriteAt(List<SourceToken> tokens, int index, StringBuilder out, LoweringContext context) {
        SourceToken keyword = tokens.get(index);
        if (!keyword.isSugar("match")) {
            return -1;
        }

        int open = TokenScanner.nextSignificant(tokens, index + 1);
        if (!tokens.get(open).isPunctuation("(")) {
            return -1;
        }
        int close = TokenScanner.findClosing(tokens, open);
        if (close < 0 || !tokens.get(close).isPunctuation(")")) {
            return -1;
        }
        int brace = TokenScanner.nextSignificant(tokens, close + 1);
        if (!tokens.get(brace).isPunctuation("{")) {
            return -1;
        }
        int end = TokenScanner.findClosing(tokens, brace);
        if (end < 0 || !tokens.get(end).isPunctuation("}")) {
            return -1;
        }

        String scrutinee = TokenScanner.text(tokens, open + 1, close).strip();
        if (scrutinee.isEmpty()) {
            return -1;
        }

        List<Arm> arms = new ArrayList<>();
        int trailingStart = parseArms(tokens, brace + 1, end, arms);
        if (trailingStart < 0) {
            log.warn("Leaving unparsable match at line {} untouched", keyword.getLine());
            return -1;
        }
        for (int i = 0; i < arms.size() - 1; i++) {
            if (arms.get(i).getPattern().isWildcard()) {
                log.warn("Leaving match at line {} untouched: wildcard arm is not last", keyword.getLine());
                return -1;
            }
        }

        String cached = CACHED_PREFIX + context.nextMatchId();
        StringBuilder sb = new StringBuilder();
        sb.append("{ __typeof__(").append(scrutinee).append(") ").append(cached)
                .append(" = (").append(scrutinee).append(");");

        boolean conditional = false;
        boolean wildcard = false;
        for (Arm arm : arms) {
            sb.append(arm.getLeading().isEmpty() ? " " : arm.getLeading());
            String body = apply(arm.getBody(), context);
            MatchPattern pattern = arm.getPattern();
            if (pattern.isWildcard()) {
                wildcard = true;
                if (conditional) {
                    sb.append("else ");
                } else {
                    sb.append("(void)").append(cached).append("; ");
                }
                sb.append(block(body, ""));
            } else {
                sb.append(conditional ? "else if (" : "if (").append(pattern.condition(cached)).append(") ");
                sb.append(block(body, pattern.bindings(cached)));
                conditional = true;
            }
        }
        if (!conditional && !wildcard) {
            sb.append(" (void)").append(cached).append(';');
        } else if (conditional && !wildcard) {
            sb.append(" else { }");
        }
        sb.append(TokenScanner.text(tokens, trailingStart, end));
        sb.append(" }");

        log.debug("Lowered match at line {} into {} with {} arms", keyword.getLine(), cached, arms.size());
        String original = TokenScanner.text(tokens, index, end + 1);
        out.append(alignLines(original, sb.toString(), tokens.get(end + 1).getLine()));
        return end + 1;
    }

    /**
     * Collects the arms between the braces. Returns the index where the
     * trivia after the last arm starts, or -1 when an arm does not parse.
     */
    private int parseArms(List<SourceToken> tokens, int from, int to, List<Arm> arms) {
        int pos = from;
        while (true) {
            int start = TokenScanner.nextSignificant(tokens, pos);
            if (start >= to) {
                return pos;
            }

            int arrow = TokenScanner.findAtDepthZero(tokens, start, to, "=>");
            if (arrow < 0) {
                return -1;
            }
            MatchPattern pattern = MatchPattern.parse(tokens, start, arrow);
            if (pattern == null) {
                return -1;
            }

            int bodyStart = TokenScanner.nextSignificant(tokens, arrow + 1);
            if (bodyStart >= to) {
                return -1;
            }

            String body;
            int next;
            if (tokens.get(bodyStart).isPunctuation("{")) {
                int bodyEnd = TokenScanner.findClosing(tokens, bodyStart);
                if (bodyEnd < 0 || bodyEnd >= to) {
                    return -1;
                }
                body = TokenScanner.text(tokens, bodyStart, bodyEnd + 1);
                next = bodyEnd + 1;
                int separator = TokenScanner.nextSignificant(tokens, next);
                if (separator < to
                        && (tokens.get(separator).isPunctuation(";") || tokens.get(separator).isPunctuation(","))) {
                    next = separator + 1;
                }
            } else {
                int semicolon = TokenScanner.findAtDepthZero(tokens, bodyStart, to, ";");
                if (semicolon < 0) {
                    return -1;
                }
                body = TokenScanner.text(tokens, bodyStart, semicolon + 1);
                next = semicolon + 1;
            }

            arms.add(new Arm(TokenScanner.text(tokens, pos, start), pattern, body));
            pos = next;
        }
    }

    private static String block(String body, String bindings) {
        if (bindings.isEmpty() && body.startsWith("{")) {
            return body;
        }
        return "{ " + bindings + body + " }";
    }

    @Value
    private static class Arm {
        /** Whitespace and comments before the pattern. */
        String leading;
        MatchPattern pattern;
        String body;
    }
}
