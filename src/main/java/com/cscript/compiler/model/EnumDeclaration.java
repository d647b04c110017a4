package com.cscript.compiler.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A tagged enum declared with {@code enum!} (or {@code enum_flags!} when {@link #flags} is set).
 */
@Value
@Builder
public class EnumDeclaration {

    @NonNull
    String name;

    @Singular
    List<EnumVariant> variants;

    int line;

    /**
     * Bit-flag enums combine variants and are never checked for exhaustiveness.
     */
    boolean flags;

    public List<String> variantNames() {
        return variants.stream().map(EnumVariant::getName).collect(Collectors.toList());
    }

    public boolean hasVariant(String name) {
        return variants.stream().anyMatch(v -> v.getName().equals(name));
    }
}
