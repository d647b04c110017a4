package com.cscript.compiler.model;

import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * One variant of a tagged enum, with its explicit value text when one was written.
 */
@Value
public class EnumVariant {

    @NonNull
    String name;

    String explicitValue;

    public Optional<String> getExplicitValue() {
        return Optional.ofNullable(explicitValue);
    }
}
