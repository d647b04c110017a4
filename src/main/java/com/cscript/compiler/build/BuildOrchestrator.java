package com.cscript.compiler.build;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.build.profile.FunctionAnnotator;
import com.cscript.compiler.build.profile.HotFunctionSelector;
import com.cscript.compiler.build.profile.ProfilePolicy;
import com.cscript.compiler.build.profile.ProfileSampleReader;
import com.cscript.compiler.build.toolchain.ProgramRunner;
import com.cscript.compiler.build.toolchain.RunResult;
import com.cscript.compiler.build.toolchain.Toolchain;
import com.cscript.compiler.build.toolchain.ToolchainException;
import com.cscript.compiler.build.toolchain.ToolchainInvocation;
import com.cscript.compiler.build.toolchain.ToolchainResult;
import com.cscript.compiler.model.BuildArtifact;
import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.Diagnostic;
import com.cscript.compiler.model.DiagnosticKind;
import com.cscript.compiler.model.ProfileSample;
import com.cscript.compiler.prelude.PreludeComposer;

/**
 * Turns lowered text into exactly one executable.
 *
 * <p>A plain build compiles once into a staging file beside the output and
 * renames it into place. A profile-guided build first compiles an
 * instrumented program into the private workspace, runs it once to count
 * function entries, then compiles again with the hottest functions marked.
 * Every intermediate is removed before {@link #build} returns, whatever the
 * outcome; the output path is only ever written by the final rename.
 */
public class BuildOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BuildOrchestrator.class);

    public static final String PROFILE_OUTPUT_ENV = "CS_PROFILE_OUT";

    static final String INSTRUMENTED_SOURCE = "instrumented.c";
    static final String INSTRUMENTED_EXECUTABLE = "instrumented.bin";
    static final String PROFILE_FILE = "profile.txt";
    static final String FINAL_SOURCE = "unit.c";

    private final Toolchain toolchain;
    private final ProgramRunner runner;
    private final OrchestratorSettings settings;
    private final PreludeComposer preludeComposer;
    private final FunctionAnnotator annotator;
    private final ProfilePolicy profilePolicy;
    private final HotFunctionSelector hotFunctionSelector;
    private final ProfileSampleReader sampleReader;

    public BuildOrchestrator(Toolchain toolchain, ProgramRunner runner, OrchestratorSettings settings) {
        this(toolchain, runner, settings, new PreludeComposer());
    }

    public BuildOrchestrator(Toolchain toolchain, ProgramRunner runner, OrchestratorSettings settings,
                             PreludeComposer preludeComposer) {
        this.toolchain = toolchain;
        this.runner = runner;
        this.settings = settings;
        this.preludeComposer = preludeComposer;
        this.annotator = new FunctionAnnotator();
        this.profilePolicy = new ProfilePolicy(annotator);
        this.hotFunctionSelector = new HotFunctionSelector();
        this.sampleReader = new ProfileSampleReader();
    }

    /**
     * @param unitName name the C compiler reports in diagnostics for lines of the unit
     */
    public BuildOutcome build(String unitName, String loweredText, Configuration configuration) {
        BuildStateMachine machine = new BuildStateMachine();
        machine.transitionTo(BuildState.LOWERED);
        Path output = Paths.get(configuration.getOut()).toAbsolutePath().normalize();

        try (TempWorkspace workspace = TempWorkspace.create(settings.getTempRoot(), output)) {
            return build(unitName, loweredText, configuration, output, workspace, machine);
        } catch (IOException e) {
            return fail(machine, BuildOutcome.builder(), DiagnosticKind.IO_FAILURE,
                    "cannot create build workspace: " + e.getMessage(), "");
        }
    }

    private BuildOutcome build(String unitName, String loweredText, Configuration configuration, Path output,
                               TempWorkspace workspace, BuildStateMachine machine) {
        BuildOutcome.BuildOutcomeBuilder outcome = BuildOutcome.builder();
        List<String> hotFunctions = List.of();

        if (profilePolicy.shouldProfile(configuration, loweredText)) {
            progress(configuration, "Profile-guided build: instrumented pass");
            BuildOutcome failure = null;
            ProfilingPass pass = new ProfilingPass(unitName, loweredText, configuration, workspace,
                    machine, outcome);
            try {
                failure = pass.run();
            } catch (ToolchainException e) {
                failure = pass.failCurrentPass(e.getMessage());
            }
            if (failure != null) {
                return failure;
            }
            hotFunctions = pass.hotFunctions;
        }

        progress(configuration, "Final build to {}", output);
        String text = hotFunctions.isEmpty() ? loweredText : annotator.markHot(loweredText, hotFunctions);
        Path source = workspace.resolve(FINAL_SOURCE);
        Path staging = workspace.getStagingFile();

        ToolchainResult result;
        try {
            writeUnit(source, configuration, unitName, text);
            result = toolchain.compile(ToolchainInvocation.builder()
                    .source(source)
                    .output(staging)
                    .configuration(configuration)
                    .instrumented(false)
                    .build());
        } catch (IOException e) {
            return fail(machine, outcome, DiagnosticKind.IO_FAILURE, "cannot write " + source + ": " + e.getMessage(), "");
        } catch (ToolchainException e) {
            return fail(machine, outcome, DiagnosticKind.FINAL_BUILD_FAILURE, e.getMessage(), "");
        }

        if (!result.isSuccess() || !Files.isRegularFile(staging)) {
            return fail(machine, outcome, DiagnosticKind.FINAL_BUILD_FAILURE,
                    "compiler exited with status " + result.getExitCode(), result.getDiagnostics());
        }
        machine.transitionTo(BuildState.FINAL_BUILT);

        try {
            workspace.publish(output);
        } catch (IOException e) {
            return fail(machine, outcome, DiagnosticKind.IO_FAILURE,
                    "cannot move executable to " + output + ": " + e.getMessage(), result.getDiagnostics());
        }
        machine.transitionTo(BuildState.DONE);
        progress(configuration, "Built {}", output);

        return outcome
                .state(BuildState.DONE)
                .artifact(new BuildArtifact(output))
                .toolchainOutput(result.getDiagnostics())
                .stateHistory(machine.getHistory())
                .build();
    }

    /**
     * Written as ISO-8859-1, the charset units are read with, so every byte of
     * the source reaches the compiler unchanged.
     */
    private void writeUnit(Path file, Configuration configuration, String unitName, String text)
            throws IOException {
        Files.writeString(file, preludeComposer.composeUnit(configuration, unitName, text),
                StandardCharsets.ISO_8859_1);
    }

    private static void progress(Configuration configuration, String format, Object... args) {
        if (configuration.isAnim()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private static BuildOutcome fail(BuildStateMachine machine, BuildOutcome.BuildOutcomeBuilder outcome,
                                     DiagnosticKind kind, String message, String toolchainOutput) {
        log.debug("Build failed in state {}: {}: {}", machine.getCurrent(), kind, message);
        machine.fail();
        return outcome
                .state(BuildState.FAILED)
                .failureKind(kind)
                .diagnostic(Diagnostic.error(0, kind, message))
                .toolchainOutput(toolchainOutput)
                .stateHistory(machine.getHistory())
                .build();
    }

    /**
     * The instrumented compile and run. {@link #run} returns a failed outcome
     * or null when the final build should proceed.
     */
    private class ProfilingPass {
        private final String unitName;
        private final String loweredText;
        private final Configuration configuration;
        private final TempWorkspace workspace;
        private final BuildStateMachine machine;
        private final BuildOutcome.BuildOutcomeBuilder outcome;
        private List<String> hotFunctions = List.of();

        ProfilingPass(String unitName, String loweredText, Configuration configuration, TempWorkspace workspace,
                      BuildStateMachine machine, BuildOutcome.BuildOutcomeBuilder outcome) {
            this.unitName = unitName;
            this.loweredText = loweredText;
            this.configuration = configuration;
            this.workspace = workspace;
            this.machine = machine;
            this.outcome = outcome;
        }

        BuildOutcome run() {
            Path source = workspace.resolve(INSTRUMENTED_SOURCE);
            Path executable = workspace.resolve(INSTRUMENTED_EXECUTABLE);
            try {
                writeUnit(source, configuration, unitName, annotator.instrument(loweredText));
            } catch (IOException e) {
                return fail(machine, outcome, DiagnosticKind.IO_FAILURE,
                        "cannot write " + source + ": " + e.getMessage(), "");
            }

            ToolchainResult compiled = toolchain.compile(ToolchainInvocation.builder()
                    .source(source)
                    .output(executable)
                    .configuration(configuration)
                    .instrumented(true)
                    .build());
            if (!compiled.isSuccess() || !Files.isRegularFile(executable)) {
                return fail(machine, outcome, DiagnosticKind.PROFILING_BUILD_FAILURE,
                        "instrumented compile exited with status " + compiled.getExitCode(), compiled.getDiagnostics());
            }
            machine.transitionTo(BuildState.PROFILING_BUILT);

            progress(configuration, "Profile-guided build: running instrumented program");
            Path profile = workspace.resolve(PROFILE_FILE);
            RunResult run = runner.run(executable, Map.of(PROFILE_OUTPUT_ENV, profile.toString()),
                    settings.getProfileTimeout());

            if (run.isTimedOut()) {
                String message = "instrumented run exceeded " + settings.getProfileTimeout().toMillis() + " ms";
                if (!settings.isFallbackOnProfileTimeout()) {
                    return fail(machine, outcome, DiagnosticKind.PROFILING_RUN_FAILURE, message, run.getOutput());
                }
                log.warn("{}; building without profile data", message);
                outcome.diagnostic(Diagnostic.warning(0, DiagnosticKind.PROFILING_RUN_FAILURE,
                        message + ", built without profile data"));
                outcome.profileFallback(true);
                return null;
            }
            if (run.getExitCode() != 0) {
                return fail(machine, outcome, DiagnosticKind.PROFILING_RUN_FAILURE,
                        "instrumented run exited with status " + run.getExitCode(), run.getOutput());
            }
            machine.transitionTo(BuildState.PROFILING_RUN);

            ProfileSample sample;
            try {
                sample = sampleReader.read(profile);
            } catch (IOException e) {
                return fail(machine, outcome, DiagnosticKind.IO_FAILURE,
                        "cannot read profile " + profile + ": " + e.getMessage(), "");
            }
            hotFunctions = hotFunctionSelector.select(sample, settings.getHotFunctionLimit());
            outcome.hotFunctions(hotFunctions);
            progress(configuration, "Hot functions: {}", hotFunctions.isEmpty() ? "none" : String.join(", ", hotFunctions));
            return null;
        }

        BuildOutcome failCurrentPass(String message) {
            DiagnosticKind kind = machine.getCurrent() == BuildState.LOWERED
                    ? DiagnosticKind.PROFILING_BUILD_FAILURE
                    : DiagnosticKind.PROFILING_RUN_FAILURE;
            return fail(machine, outcome, kind, message, "");
        }
    }
}
