package com.cscript.compiler.cli.output;

import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.CompilationResult;
import com.cscript.compiler.build.BuildOutcome;
import com.cscript.compiler.model.Diagnostic;

/**
 * Responsible only for printing CLI output of {@code cscriptc}. Diagnostics
 * go to the error stream as {@code file:line: kind: message}; the artifact
 * path is the only thing written to the output stream.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    private final PrintWriter out;
    private final PrintWriter err;

    public CompileResultsPrinter(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    public void printDiagnostics(CompilationResult result) {
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            err.println(diagnostic.format(result.getUnitName()));
        }
        BuildOutcome outcome = result.getBuildOutcome();
        if (outcome != null && !outcome.isSuccess() && !outcome.getToolchainOutput().isBlank()) {
            err.print(outcome.getToolchainOutput());
        }
        err.flush();
    }

    public void printSuccess(CompilationResult result) {
        printDiagnostics(result);
        BuildOutcome outcome = result.getBuildOutcome();
        if (!outcome.getHotFunctions().isEmpty()) {
            log.info("Hot functions: {}", String.join(", ", outcome.getHotFunctions()));
        }
        result.findArtifact().ifPresent(artifact -> out.println(artifact.getPath()));
        out.flush();
    }

    public void printFailure(CompilationResult result) {
        printDiagnostics(result);
        long errors = result.getDiagnostics().stream().filter(Diagnostic::isError).count();
        log.error("{}: compilation failed with {} error(s)", result.getUnitName(), errors);
    }

    public void printValidationErrors(Iterable<String> errors) {
        for (String error : errors) {
            err.println("cscriptc: " + error);
        }
        err.flush();
    }

    public void printSource(String composedC) {
        out.print(composedC);
        out.flush();
    }
}
