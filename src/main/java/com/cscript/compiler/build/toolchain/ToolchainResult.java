package com.cscript.compiler.build.toolchain;

import lombok.Value;

/**
 * Exit status and combined stdout/stderr of one compiler run.
 */
@Value
public class ToolchainResult {
    int exitCode;
    String diagnostics;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
