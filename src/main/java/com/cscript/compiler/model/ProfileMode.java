package com.cscript.compiler.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Values of the {@code @profile} directive.
 */
public enum ProfileMode {
    ON("on"),
    OFF("off"),
    AUTO("auto");

    private final String directiveValue;

    ProfileMode(String directiveValue) {
        this.directiveValue = directiveValue;
    }

    public static Optional<ProfileMode> fromDirective(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.directiveValue.equals(value))
                .findFirst();
    }

    @Override
    public String toString() {
        return directiveValue;
    }
}
