package com.cscript.compiler.lowering;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.model.Configuration;

/**
 * Applies the sugar rules to a unit, in a fixed order, when softline is on.
 * Text no rule recognizes passes through unchanged.
 */
public class LoweringEngine {
    private static final Logger log = LoggerFactory.getLogger(LoweringEngine.class);

    private final List<LoweringRule> rules;

    public LoweringEngine() {
        this(List.of(
                new ExpressionFunctionRule(),
                new BlockFunctionRule(),
                new BindingRule(),
                new TaggedEnumRule(),
                new MatchRule(),
                new UnsafeBlockRule()));
    }

    public LoweringEngine(List<LoweringRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public LoweringResult lower(String text, Configuration configuration) {
        if (!configuration.isSoftline()) {
            log.debug("Softline is off, passing {} characters through", text.length());
            return LoweringResult.builder().text(text).build();
        }

        LoweringContext context = new LoweringContext();
        String current = text;
        for (LoweringRule rule : rules) {
            current = rule.apply(current, context);
        }

        LoweringResult result = LoweringResult.builder()
                .text(current)
                .enumDeclarations(context.getEnumDeclarations())
                .rewriteCounts(context.getRewriteCounts())
                .build();
        log.debug("Lowering applied {} rewrites {}", result.totalRewrites(), result.getRewriteCounts());
        return result;
    }
}
