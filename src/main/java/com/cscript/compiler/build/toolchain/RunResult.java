package com.cscript.compiler.build.toolchain;

import lombok.Value;

/**
 * Outcome of running a built program once. The exit code is meaningless when
 * the run timed out.
 */
@Value
public class RunResult {
    int exitCode;
    String output;
    boolean timedOut;

    public static RunResult exited(int exitCode, String output) {
        return new RunResult(exitCode, output, false);
    }

    public static RunResult timeout(String output) {
        return new RunResult(-1, output, true);
    }
}
