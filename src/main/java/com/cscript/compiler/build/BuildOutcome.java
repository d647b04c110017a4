package com.cscript.compiler.build;

import java.util.List;
import java.util.Optional;

import com.cscript.compiler.model.BuildArtifact;
import com.cscript.compiler.model.Diagnostic;
import com.cscript.compiler.model.DiagnosticKind;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Result of one orchestrated build. Failures are reported here, never thrown.
 */
@Value
@Builder
public class BuildOutcome {

    BuildState state;

    /**
     * Present only when {@link #state} is {@link BuildState#DONE}.
     */
    BuildArtifact artifact;

    /**
     * Set when the build failed.
     */
    DiagnosticKind failureKind;

    @Singular
    List<Diagnostic> diagnostics;

    /**
     * Output of the compiler run that decided the outcome, forwarded verbatim.
     */
    @Builder.Default
    String toolchainOutput = "";

    @Singular
    List<String> hotFunctions;

    /**
     * The instrumented run timed out and the final build used no profile data.
     */
    boolean profileFallback;

    @Builder.Default
    List<BuildState> stateHistory = List.of();

    public boolean isSuccess() {
        return state == BuildState.DONE;
    }

    public Optional<BuildArtifact> findArtifact() {
        return Optional.ofNullable(artifact);
    }
}
