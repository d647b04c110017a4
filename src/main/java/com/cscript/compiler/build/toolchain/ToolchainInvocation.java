package com.cscript.compiler.build.toolchain;

import java.nio.file.Path;

import com.cscript.compiler.model.Configuration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One compile of a C file into an executable.
 */
@Value
@Builder
public class ToolchainInvocation {

    @NonNull
    Path source;

    @NonNull
    Path output;

    @NonNull
    Configuration configuration;

    /**
     * Adds {@code -DCS_PROFILE_BUILD=1} so the prelude compiles the profiler in.
     */
    boolean instrumented;
}
