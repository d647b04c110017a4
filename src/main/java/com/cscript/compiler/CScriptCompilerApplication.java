package com.cscript.compiler;

import com.cscript.compiler.cli.CompileCommand;

import picocli.CommandLine;

/**
 * Main entry point of {@code cscriptc}, the C-Script to C translator and build driver.
 */
public class CScriptCompilerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CompileCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
