package com.cscript.compiler.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Build configuration assembled from command-line defaults and source directives.
 *
 * Scalar settings are last-wins while the builder is being fed; list settings
 * (macro definitions, include and library paths, link libraries) accumulate in
 * source order. Instances are immutable.
 */
@Value
@Builder(toBuilder = true)
public class Configuration {

    public static final String DEFAULT_OUTPUT = "a.out";

    /**
     * Strict diagnostics and runtime enum assertions.
     */
    @Builder.Default
    boolean hardline = true;

    /**
     * Convenience-syntax lowering.
     */
    @Builder.Default
    boolean softline = true;

    @Builder.Default
    OptLevel opt = OptLevel.O2;

    @Builder.Default
    boolean lto = true;

    @Builder.Default
    ProfileMode profile = ProfileMode.OFF;

    @Builder.Default
    String out = DEFAULT_OUTPUT;

    /**
     * Passed through uninterpreted.
     */
    @Builder.Default
    String abi = "";

    @Singular
    List<String> defines;

    @Singular
    List<String> includePaths;

    @Singular
    List<String> libraryPaths;

    @Singular
    List<String> links;

    @Builder.Default
    boolean guardian = false;

    @Builder.Default
    boolean anim = false;

    @Builder.Default
    boolean muttrack = false;

    @Builder.Default
    boolean debug = false;

    public static Configuration defaults() {
        return Configuration.builder().build();
    }
}
