package com.cscript.compiler.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A {@code CS_CASE(label)} occurrence inside an exhaustive region.
 */
@Value
public class CaseLabel {

    @NonNull
    String name;

    int line;
}
