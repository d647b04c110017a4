package com.cscript.compiler.model;

/**
 * Categories of problems reported while translating and building a unit.
 * The code is the stable, user-visible tag printed with each diagnostic.
 */
public enum DiagnosticKind {
    MALFORMED_DIRECTIVE("malformed-directive"),
    UNKNOWN_DIRECTIVE("unknown-directive"),
    DUPLICATE_ENUM("duplicate-enum"),
    UNKNOWN_ENUM("unknown-enum"),
    FOREIGN_VARIANT("foreign-variant"),
    NON_EXHAUSTIVE("non-exhaustive"),
    UNTERMINATED_REGION("unterminated-region"),
    PROFILING_BUILD_FAILURE("profiling-build-failure"),
    PROFILING_RUN_FAILURE("profiling-run-failure"),
    FINAL_BUILD_FAILURE("final-build-failure"),
    IO_FAILURE("io-failure");

    private final String code;

    DiagnosticKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
