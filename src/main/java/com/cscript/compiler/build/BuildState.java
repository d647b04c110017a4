package com.cscript.compiler.build;

/**
 * Phases of one orchestrated build.
 */
public enum BuildState {
    IDLE,
    LOWERED,
    PROFILING_BUILT,
    PROFILING_RUN,
    FINAL_BUILT,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
