package com.cscript.compiler.build;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import com.cscript.compiler.build.profile.HotFunctionSelector;

import lombok.Builder;
import lombok.Value;

/**
 * Knobs of the build orchestrator that do not come from source directives.
 */
@Value
@Builder(toBuilder = true)
public class OrchestratorSettings {

    public static final Duration DEFAULT_PROFILE_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Parent of the per-build private workspace.
     */
    @Builder.Default
    Path tempRoot = Paths.get(System.getProperty("java.io.tmpdir"));

    /**
     * Upper bound for the instrumented run.
     */
    @Builder.Default
    Duration profileTimeout = DEFAULT_PROFILE_TIMEOUT;

    @Builder.Default
    int hotFunctionLimit = HotFunctionSelector.DEFAULT_LIMIT;

    /**
     * When the instrumented run times out, build without profile data instead of failing.
     */
    @Builder.Default
    boolean fallbackOnProfileTimeout = true;

    public static OrchestratorSettings defaults() {
        return OrchestratorSettings.builder().build();
    }
}
