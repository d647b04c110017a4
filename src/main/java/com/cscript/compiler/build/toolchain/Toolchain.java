package com.cscript.compiler.build.toolchain;

/**
 * The external C compiler.
 */
public interface Toolchain {

    /**
     * Compiles and links synchronously.
     *
     * @throws ToolchainException when the compiler cannot be started
     */
    ToolchainResult compile(ToolchainInvocation invocation);
}
