package com.cscript.compiler.build.toolchain;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Runs a built executable, used for the instrumented profiling run.
 */
public interface ProgramRunner {

    /**
     * Runs {@code executable} with {@code environment} added to the inherited
     * environment and waits at most {@code timeout}. A program still running
     * at the deadline is killed and reported as timed out.
     *
     * @throws ToolchainException when the program cannot be started
     */
    RunResult run(Path executable, Map<String, String> environment, Duration timeout);
}
