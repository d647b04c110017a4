package com.cscript.compiler;

import java.util.List;
import java.util.Optional;

import com.cscript.compiler.build.BuildOutcome;
import com.cscript.compiler.model.BuildArtifact;
import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.Diagnostic;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Result of compiling one unit end to end.
 */
@Value
@Builder
public class CompilationResult {
    boolean success;
    String unitName;

    /**
     * Effective configuration; null when directive extraction failed.
     */
    Configuration configuration;

    /**
     * Every diagnostic of the unit, warnings included, in the order they were raised.
     */
    @Singular
    List<Diagnostic> diagnostics;

    /**
     * Null when the unit failed before the build started.
     */
    BuildOutcome buildOutcome;

    public Optional<BuildArtifact> findArtifact() {
        return buildOutcome == null ? Optional.empty() : buildOutcome.findArtifact();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public static CompilationResult failure(String unitName, List<Diagnostic> diagnostics) {
        return CompilationResult.builder()
                .success(false)
                .unitName(unitName)
                .diagnostics(diagnostics)
                .build();
    }
}
