package com.cscript.compiler.lowering;

/**
 * One sugar-to-C rewrite. Implementations must be idempotent: applying a rule
 * to its own output changes nothing.
 */
public interface LoweringRule {

    String name();

    String apply(String text, LoweringContext context);
}
