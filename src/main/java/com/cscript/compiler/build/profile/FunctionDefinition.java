package com.cscript.compiler.build.profile;

import lombok.Value;

/**
 * A top-level function definition found in lowered text.
 */
@Value
public class FunctionDefinition {
    String name;
    int line;
    /** Offset of the first token of the declaration specifiers. */
    int headerOffset;
    /** Offset of the opening brace of the body. */
    int bodyOffset;
}
