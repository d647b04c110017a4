package com.cscript.compiler.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Optimization levels accepted by the {@code @opt} directive.
 */
public enum OptLevel {
    O0("O0", "-O0"),
    O1("O1", "-O1"),
    O2("O2", "-O2"),
    O3("O3", "-O3"),
    MAX("max", "-O3"),
    SIZE("size", "-Os");

    private final String directiveValue;
    private final String compilerFlag;

    OptLevel(String directiveValue, String compilerFlag) {
        this.directiveValue = directiveValue;
        this.compilerFlag = compilerFlag;
    }

    public String getCompilerFlag() {
        return compilerFlag;
    }

    public boolean isAggressive() {
        return this == O3 || this == MAX;
    }

    /**
     * Resolves a directive or command-line value; accepts {@code O2} as well as {@code 2}.
     */
    public static Optional<OptLevel> fromDirective(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.matches("[0-3]") ? "O" + value : value;
        return Arrays.stream(values())
                .filter(level -> level.directiveValue.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return directiveValue;
    }
}
