package com.cscript.compiler.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A span between {@code CS_SWITCH_EXHAUSTIVE(T, ...)} and {@code CS_SWITCH_END(T, ...)}
 * claiming to cover every variant of enum {@code T}.
 */
@Value
@Builder
public class ExhaustivenessRegion {

    int line;

    @NonNull
    String enumName;

    @Singular
    List<CaseLabel> labels;

    /**
     * False when no matching end marker was found.
     */
    boolean terminated;

    public Set<String> covered() {
        Set<String> covered = new LinkedHashSet<>();
        labels.forEach(label -> covered.add(label.getName()));
        return covered;
    }
}
