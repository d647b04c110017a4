package com.cscript.compiler.build;

import com.cscript.compiler.build.toolchain.ToolchainInvocation;
import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.DiagnosticKind;
import com.cscript.compiler.model.OptLevel;
import com.cscript.compiler.model.ProfileMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BuildOrchestrator.
 */
class BuildOrchestratorTest {

    private static final String PROGRAM = """
            int a(int x) { return x + 1; }
            int b(int x) { return x * 2; }
            int c(int x) { return x - 1; }
            int main(void) { return a(1) + b(2) + c(3); }
            """;

    @TempDir
    Path tempDir;

    private Path tempRoot;
    private Path outDir;
    private Path output;
    private FakeToolchain toolchain;
    private FakeProgramRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        tempRoot = Files.createDirectories(tempDir.resolve("tmp"));
        outDir = Files.createDirectories(tempDir.resolve("out"));
        output = outDir.resolve("prog");
        toolchain = new FakeToolchain();
        runner = new FakeProgramRunner();
    }

    private BuildOrchestrator orchestrator() {
        return orchestrator(OrchestratorSettings.builder().tempRoot(tempRoot).build());
    }

    private BuildOrchestrator orchestrator(OrchestratorSettings settings) {
        return new BuildOrchestrator(toolchain, runner, settings);
    }

    private Configuration.ConfigurationBuilder config() {
        return Configuration.builder().out(output.toString());
    }

    private List<String> listing(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString()).collect(Collectors.toList());
        }
    }

    private void assertNoIntermediatesLeft() throws IOException {
        assertThat(listing(tempRoot)).isEmpty();
        assertThat(listing(outDir)).allMatch(name -> !name.endsWith(".tmp"));
    }

    @Test
    void testPlainBuildCompilesOnce() throws IOException {
        BuildOutcome outcome = orchestrator().build("prog.csc", PROGRAM, config().build());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.findArtifact()).hasValueSatisfying(
                artifact -> assertThat(artifact.getPath()).isEqualTo(output.toAbsolutePath().normalize()));
        assertThat(outcome.getStateHistory()).containsExactly(
                BuildState.IDLE, BuildState.LOWERED, BuildState.FINAL_BUILT, BuildState.DONE);
        assertThat(toolchain.getInvocations()).hasSize(1);
        assertThat(toolchain.getInvocations().get(0).isInstrumented()).isFalse();
        assertThat(toolchain.getCompiledSources().get(0))
                .contains("// --- end of prelude ---")
                .endsWith(PROGRAM);
        assertThat(runner.getExecutables()).isEmpty();
        assertThat(output).exists();
        assertNoIntermediatesLeft();
    }

    @Test
    void testFailingInstrumentedRunLeavesOutputUntouched() throws IOException {
        Files.writeString(output, "previous build");
        runner.exitingWith(1);

        BuildOutcome outcome = orchestrator().build("prog.csc", PROGRAM, config().profile(ProfileMode.ON).build());

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getFailureKind()).isEqualTo(DiagnosticKind.PROFILING_RUN_FAILURE);
        assertThat(outcome.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.getMessage()).isEqualTo("instrumented run exited with status 1"));
        assertThat(outcome.getStateHistory()).containsExactly(
                BuildState.IDLE, BuildState.LOWERED, BuildState.PROFILING_BUILT, BuildState.FAILED);
        assertThat(toolchain.getInvocations()).hasSize(1);
        assertThat(Files.readString(output)).isEqualTo("previous build");
        assertNoIntermediatesLeft();
    }

    @Test
    void testInstrumentedCompileFailure() throws IOException {
        toolchain.thenFail(1, "instrumented.c:3: error: expected ';'\n");

        BuildOutcome outcome = orchestrator().build("prog.csc", PROGRAM, config().profile(ProfileMode.ON).build());

        assertThat(outcome.getFailureKind()).isEqualTo(DiagnosticKind.PROFILING_BUILD_FAILURE);
        assertThat(outcome.getToolchainOutput()).contains("expected ';'");
        assertThat(runner.getExecutables()).isEmpty();
        assertThat(output).doesNotExist();
        assertNoIntermediatesLeft();
    }

    @Test
    void testProfileGuidedBuildMarksHottestFunctions() throws IOException {
        runner.writingProfile("main 1\na 50\nb 10\nc 50\n");
        OrchestratorSettings settings = OrchestratorSettings.builder()
                .tempRoot(tempRoot)
                .hotFunctionLimit(2)
                .build();

        BuildOutcome outcome = orchestrator(settings).build("prog.csc", PROGRAM, config().profile(ProfileMode.ON).build());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getHotFunctions()).containsExactly("a", "c");
        assertThat(outcome.getStateHistory()).containsExactly(
                BuildState.IDLE, BuildState.LOWERED, BuildState.PROFILING_BUILT,
                BuildState.PROFILING_RUN, BuildState.FINAL_BUILT, BuildState.DONE);

        assertThat(toolchain.getInvocations()).extracting(ToolchainInvocation::isInstrumented)
                .containsExactly(true, false);
        assertThat(toolchain.getCompiledSources().get(0))
                .contains("int main(void) { cs_prof_hit(\"main\");")
                .contains("int a(int x) { cs_prof_hit(\"a\");");
        assertThat(toolchain.getCompiledSources().get(1))
                .contains("CS_HOT int a(int x)")
                .contains("CS_HOT int c(int x)")
                .doesNotContain("CS_HOT int b(int x)")
                .doesNotContain("cs_prof_hit(\"a\")");
        assertThat(output).exists();
        assertNoIntermediatesLeft();
    }

    @Test
    void testTimedOutRunFallsBackToPlainBuild() throws IOException {
        runner.timingOut();
        OrchestratorSettings settings = OrchestratorSettings.builder()
                .tempRoot(tempRoot)
                .profileTimeout(Duration.ofMillis(250))
                .build();

        BuildOutcome outcome = orchestrator(settings).build("prog.csc", PROGRAM, config().profile(ProfileMode.ON).build());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isProfileFallback()).isTrue();
        assertThat(outcome.getHotFunctions()).isEmpty();
        assertThat(outcome.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.isError()).isFalse();
            assertThat(d.getKind()).isEqualTo(DiagnosticKind.PROFILING_RUN_FAILURE);
            assertThat(d.getMessage()).contains("250 ms");
        });
        assertThat(outcome.getStateHistory()).containsExactly(
                BuildState.IDLE, BuildState.LOWERED, BuildState.PROFILING_BUILT,
                BuildState.FINAL_BUILT, BuildState.DONE);
        assertThat(toolchain.getCompiledSources().get(1)).doesNotContain("CS_HOT int");
        assertNoIntermediatesLeft();
    }

    @Test
    void testTimedOutRunFailsWhenFallbackDisabled() throws IOException {
        runner.timingOut();
        OrchestratorSettings settings = OrchestratorSettings.builder()
                .tempRoot(tempRoot)
                .fallbackOnProfileTimeout(false)
                .build();

        BuildOutcome outcome = orchestrator(settings).build("prog.csc", PROGRAM, config().profile(ProfileMode.ON).build());

        assertThat(outcome.getFailureKind()).isEqualTo(DiagnosticKind.PROFILING_RUN_FAILURE);
        assertThat(toolchain.getInvocations()).hasSize(1);
        assertThat(output).doesNotExist();
        assertNoIntermediatesLeft();
    }

    @Test
    void testFinalBuildFailureForwardsCompilerOutput() throws IOException {
        Files.writeString(output, "previous build");
        toolchain.thenFail(1, "unit.c:1: error: boom\n");

        BuildOutcome outcome = orchestrator().build("prog.csc", PROGRAM, config().build());

        assertThat(outcome.getFailureKind()).isEqualTo(DiagnosticKind.FINAL_BUILD_FAILURE);
        assertThat(outcome.getToolchainOutput()).isEqualTo("unit.c:1: error: boom\n");
        assertThat(outcome.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.getMessage()).isEqualTo("compiler exited with status 1"));
        assertThat(outcome.findArtifact()).isEmpty();
        assertThat(Files.readString(output)).isEqualTo("previous build");
        assertNoIntermediatesLeft();
    }

    @Test
    void testAutoProfilingDependsOnOptimizationLevel() {
        orchestrator().build("prog.csc", PROGRAM, config().profile(ProfileMode.AUTO).opt(OptLevel.O3).build());
        assertThat(toolchain.getInvocations()).hasSize(2);

        FakeToolchain plain = new FakeToolchain();
        new BuildOrchestrator(plain, runner, OrchestratorSettings.builder().tempRoot(tempRoot).build())
                .build("prog.csc", PROGRAM, config().profile(ProfileMode.AUTO).opt(OptLevel.O2).build());
        assertThat(plain.getInvocations()).hasSize(1);
    }

    @Test
    void testAutoProfilingSkipsUnitsWithoutMain() {
        orchestrator().build("prog.csc", "int helper(void) { return 1; }\n",
                config().profile(ProfileMode.AUTO).opt(OptLevel.MAX).build());

        assertThat(toolchain.getInvocations()).hasSize(1);
        assertThat(runner.getExecutables()).isEmpty();
    }

    @Test
    void testUnstartableCompilerIsReportedAsFailure() throws IOException {
        toolchain.thenThrow("No C compiler found, tried [cc, clang, gcc]");

        BuildOutcome outcome = orchestrator().build("prog.csc", PROGRAM, config().profile(ProfileMode.ON).build());

        assertThat(outcome.getFailureKind()).isEqualTo(DiagnosticKind.PROFILING_BUILD_FAILURE);
        assertThat(outcome.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.getMessage()).startsWith("No C compiler found"));
        assertNoIntermediatesLeft();
    }
}
