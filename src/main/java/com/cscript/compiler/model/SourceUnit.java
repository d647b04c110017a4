package com.cscript.compiler.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A translation unit: its name, the original text and the text left after
 * directive lines were blanked. Both texts have the same number of lines.
 */
@Value
public class SourceUnit {

    @NonNull
    String name;

    @NonNull
    String originalText;

    @NonNull
    String residualText;
}
