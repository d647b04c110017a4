package com.cscript.compiler.build.toolchain;

import java.util.ArrayList;
import java.util.List;

import com.cscript.compiler.model.Configuration;

/**
 * Builds the compiler argument list, without the compiler itself, in the
 * order the toolchain expects: language and optimization flags, defines,
 * include paths, the source, the output, then library paths and libraries.
 */
public final class CompilerArguments {

    static final String LANGUAGE_STANDARD = "-std=c11";
    static final List<String> STRICT_FLAGS = List.of("-Wall", "-Wextra", "-Werror", "-Wconversion", "-Wsign-conversion");
    public static final String PROFILE_BUILD_DEFINE = "CS_PROFILE_BUILD=1";
    public static final String HARDLINE_DEFINE = "CS_HARDLINE=1";

    private CompilerArguments() {
        // Utility class
    }

    public static List<String> of(ToolchainInvocation invocation) {
        Configuration config = invocation.getConfiguration();
        List<String> args = new ArrayList<>();

        args.add(LANGUAGE_STANDARD);
        args.add(config.getOpt().getCompilerFlag());
        if (config.isDebug()) {
            args.add("-g");
        }
        if (config.isHardline()) {
            args.addAll(STRICT_FLAGS);
        }
        if (config.isLto()) {
            args.add("-flto");
        }
        if (config.isHardline()) {
            args.add("-D" + HARDLINE_DEFINE);
        }
        if (invocation.isInstrumented()) {
            args.add("-D" + PROFILE_BUILD_DEFINE);
        }
        config.getDefines().forEach(define -> args.add("-D" + define));
        config.getIncludePaths().forEach(path -> args.add("-I" + path));

        args.add(invocation.getSource().toString());
        args.add("-o");
        args.add(invocation.getOutput().toString());

        config.getLibraryPaths().forEach(path -> args.add("-L" + path));
        config.getLinks().forEach(library -> args.add("-l" + library));
        return args;
    }
}
