package com.cscript.compiler.build.toolchain;

/**
 * An external process could not be started or waited for.
 */
public class ToolchainException extends RuntimeException {

    public ToolchainException(String message) {
        super(message);
    }

    public ToolchainException(String message, Throwable cause) {
        super(message, cause);
    }
}
