package com.cscript.compiler.build.toolchain;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProcessProgramRunner implements ProgramRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessProgramRunner.class);

    private static final long OUTPUT_DRAIN_MILLIS = 1000;

    @Override
    public RunResult run(Path executable, Map<String, String> environment, Duration timeout) {
        ProcessBuilder pb = new ProcessBuilder(executable.toAbsolutePath().toString()).redirectErrorStream(true);
        pb.environment().putAll(environment);

        Process process;
        try {
            process = pb.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw new ToolchainException("Failed to start " + executable + ": " + e.getMessage(), e);
        }

        StringBuffer output = new StringBuffer();
        Thread drain = new Thread(() -> {
            try {
                output.append(ProcessToolchain.readAll(process.getInputStream()));
            } catch (IOException e) {
                log.debug("Output of {} closed early: {}", executable, e.getMessage());
            }
        }, "cscript-run-output");
        drain.setDaemon(true);
        drain.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.debug("{} still running after {} ms, killing it", executable, timeout.toMillis());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor();
                drain.join(OUTPUT_DRAIN_MILLIS);
                return RunResult.timeout(output.toString());
            }
            drain.join(OUTPUT_DRAIN_MILLIS);
            return RunResult.exited(process.exitValue(), output.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ToolchainException("Interrupted while waiting for " + executable, e);
        }
    }
}
