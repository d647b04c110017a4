package com.cscript.compiler.lowering;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.SourceToken.TokenType;
import com.cscript.compiler.lexer.TokenScanner;
import com.cscript.compiler.model.EnumDeclaration;
import com.cscript.compiler.model.EnumVariant;

/**
 * Lowers {@code enum! N { ... }} and {@code enum_flags! N { ... }}.
 *
 * <p>A tagged enum becomes a typedef plus a validity predicate and an
 * assertion helper. A flag enum becomes a typedef plus {@code N_combine} and
 * {@code N_has}. Every declaration is recorded in the context. The body is
 * copied verbatim and all generated helpers share the closing line, so the
 * line count never changes.
 */
public class TaggedEnumRule extends TokenRewriteRule {

    private static final Logger log = LoggerFactory.getLogger(TaggedEnumRule.class);

    @Override
    public String name() {
        return "tagged-enum";
    }

    @Override
    protected int rewriteAt(List<SourceToken> tokens, int index, StringBuilder out, LoweringContext context) {
        SourceToken keyword = tokens.get(index);
        boolean flags = keyword.isSugar("enum_flags!");
        if (!flags && !keyword.isSugar("enum!")) {
            return -1;
        }

        int nameIndex = TokenScanner.nextSignificant(tokens, index + 1);
        if (!tokens.get(nameIndex).is(TokenType.IDENTIFIER)) {
            return -1;
        }
        String name = tokens.get(nameIndex).getText();

        int open = TokenScanner.nextSignificant(tokens, nameIndex + 1);
        if (!tokens.get(open).isPunctuation("{")) {
            return -1;
        }
        int close = TokenScanner.findClosing(tokens, open);
        if (close < 0 || !tokens.get(close).isPunctuation("}")) {
            return -1;
        }

        List<EnumVariant> variants = parseVariants(tokens, open + 1, close);
        if (variants == null) {
            log.warn("Leaving malformed enum '{}' at line {} untouched", name, keyword.getLine());
            return -1;
        }

        int end = close + 1;
        int semicolon = TokenScanner.nextSignificant(tokens, end);
        if (tokens.get(semicolon).isPunctuation(";")) {
            end = semicolon + 1;
        }

        String body = TokenScanner.text(tokens, open + 1, close);
        String replacement = flags ? flagEnum(name, body) : taggedEnum(name, body, variants);

        context.addEnumDeclaration(EnumDeclaration.builder()
                .name(name)
                .variants(variants)
                .line(keyword.getLine())
                .flags(flags)
                .build());
        log.debug("Lowered {} '{}' with {} variants", flags ? "flag enum" : "enum", name, variants.size());

        out.append(alignLines(TokenScanner.text(tokens, index, end), replacement, tokens.get(end).getLine()));
        return end;
    }

    /**
     * Splits the body at top-level commas. Returns null when an entry does not
     * start with an identifier or has something other than {@code = value} after it.
     */
    private List<EnumVariant> parseVariants(List<SourceToken> tokens, int from, int to) {
        List<EnumVariant> variants = new ArrayList<>();
        int start = from;
        while (start < to) {
            int comma = TokenScanner.findAtDepthZero(tokens, start, to, ",");
            int end = comma < 0 ? to : comma;

            int first = TokenScanner.nextSignificant(tokens, start);
            if (first < end) {
                if (!tokens.get(first).is(TokenType.IDENTIFIER)) {
                    return null;
                }
                int after = TokenScanner.nextSignificant(tokens, first + 1);
                String value = null;
                if (after < end) {
                    if (!tokens.get(after).isPunctuation("=")) {
                        return null;
                    }
                    value = significantText(tokens, after + 1, end);
                    if (value.isEmpty()) {
                        return null;
                    }
                }
                variants.add(new EnumVariant(tokens.get(first).getText(), value));
            } else if (comma >= 0) {
                // an empty entry is only legal as the trailing comma
                return null;
            }

            if (comma < 0) {
                break;
            }
            start = comma + 1;
        }
        return variants;
    }

    private static String significantText(List<SourceToken> tokens, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            SourceToken token = tokens.get(i);
            if (token.is(TokenType.COMMENT)) {
                continue;
            }
            sb.append(token.is(TokenType.WHITESPACE) ? " " : token.getText());
        }
        return sb.toString().strip();
    }

    private static String taggedEnum(String name, String body, List<EnumVariant> variants) {
        StringBuilder predicate = new StringBuilder();
        if (variants.isEmpty()) {
            predicate.append("(void)cs__value; return 0;");
        } else {
            predicate.append("return ");
            for (int i = 0; i < variants.size(); i++) {
                if (i > 0) {
                    predicate.append(" || ");
                }
                predicate.append("cs__value == (int)").append(variants.get(i).getName());
            }
            predicate.append(';');
        }

        return "typedef enum " + name + " {" + body + "} " + name + ";"
                + " static inline int cs__enum_is_valid_" + name + "(int cs__value){ " + predicate + " }"
                + " static inline void cs__enum_assert_" + name + "(int cs__value){ CS_ENUM_CHECK(cs__enum_is_valid_"
                + name + "(cs__value), \"" + name + "\", cs__value); }";
    }

    private static String flagEnum(String name, String body) {
        return "typedef enum " + name + " {" + body + "} " + name + ";"
                + " static inline " + name + " " + name + "_combine(" + name + " a, " + name + " b){ return ("
                + name + ")((int)a | (int)b); }"
                + " static inline int " + name + "_has(" + name + " flags, " + name
                + " flag){ return ((int)flags & (int)flag) == (int)flag; }";
    }
}
