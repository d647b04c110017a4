package com.cscript.compiler.build.toolchain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ProcessProgramRunner, using shell scripts as programs.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessProgramRunnerTest {

    @TempDir
    Path tempDir;

    private final ProcessProgramRunner runner = new ProcessProgramRunner();

    private Path script(String name, String body) throws IOException {
        Path script = tempDir.resolve(name);
        Files.writeString(script, "#!/bin/sh\n" + body);
        assertThat(script.toFile().setExecutable(true)).isTrue();
        return script;
    }

    @Test
    void testCapturesOutputAndExitCode() throws IOException {
        Path program = script("exit3.sh", "echo hello\necho oops >&2\nexit 3\n");

        RunResult result = runner.run(program, Map.of(), Duration.ofSeconds(10));

        assertThat(result.isTimedOut()).isFalse();
        assertThat(result.getExitCode()).isEqualTo(3);
        assertThat(result.getOutput()).contains("hello").contains("oops");
    }

    @Test
    void testPassesEnvironment() throws IOException {
        Path profile = tempDir.resolve("profile.txt");
        Path program = script("profile.sh", "echo \"main 1\" > \"$CS_PROFILE_OUT\"\n");

        RunResult result = runner.run(program, Map.of("CS_PROFILE_OUT", profile.toString()), Duration.ofSeconds(10));

        assertThat(result.getExitCode()).isZero();
        assertThat(Files.readString(profile)).isEqualTo("main 1\n");
    }

    @Test
    void testKillsProgramAtDeadline() throws IOException {
        Path program = script("sleep.sh", "sleep 30\n");

        long started = System.nanoTime();
        RunResult result = runner.run(program, Map.of(), Duration.ofMillis(300));

        assertThat(result.isTimedOut()).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void testMissingExecutableThrows() {
        Path missing = tempDir.resolve("missing");

        assertThatThrownBy(() -> runner.run(missing, Map.of(), Duration.ofSeconds(1)))
                .isInstanceOf(ToolchainException.class)
                .hasMessageContaining("Failed to start");
    }
}
