package com.cscript.compiler.build.toolchain;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a C compiler found on the PATH. The preferred compiler is tried first,
 * then {@code cc}, {@code clang} and {@code gcc}; the first that answers
 * {@code --version} is kept for the lifetime of this instance.
 */
public class ProcessToolchain implements Toolchain {
    private static final Logger log = LoggerFactory.getLogger(ProcessToolchain.class);

    static final List<String> FALLBACK_COMPILERS = List.of("cc", "clang", "gcc");

    private final String preferredCompiler;
    private String resolvedCompiler;

    public ProcessToolchain() {
        this(null);
    }

    public ProcessToolchain(String preferredCompiler) {
        this.preferredCompiler = preferredCompiler;
    }

    @Override
    public ToolchainResult compile(ToolchainInvocation invocation) {
        List<String> command = new ArrayList<>();
        command.add(resolveCompiler());
        command.addAll(CompilerArguments.of(invocation));
        log.debug("Running: {}", String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        try {
            Process process = pb.start();
            process.getOutputStream().close();
            String output = readAll(process.getInputStream());
            int exitCode = process.waitFor();
            log.debug("Compiler exited with {}", exitCode);
            return new ToolchainResult(exitCode, output);
        } catch (IOException e) {
            throw new ToolchainException("Failed to spawn compiler: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolchainException("Compiler interrupted", e);
        }
    }

    /**
     * Compiler executable in use, probing candidates on first call.
     *
     * @throws ToolchainException when no candidate answers
     */
    public synchronized String resolveCompiler() {
        if (resolvedCompiler != null) {
            return resolvedCompiler;
        }

        Set<String> candidates = new LinkedHashSet<>();
        if (preferredCompiler != null && !preferredCompiler.isBlank()) {
            candidates.add(preferredCompiler);
        }
        candidates.addAll(FALLBACK_COMPILERS);

        for (String candidate : candidates) {
            if (isAvailable(candidate)) {
                log.debug("Using C compiler '{}'", candidate);
                resolvedCompiler = candidate;
                return candidate;
            }
        }
        throw new ToolchainException("No C compiler found, tried " + candidates);
    }

    private boolean isAvailable(String compiler) {
        try {
            Process process = new ProcessBuilder(compiler, "--version").redirectErrorStream(true).start();
            process.getOutputStream().close();
            readAll(process.getInputStream());
            return process.waitFor() == 0;
        } catch (IOException e) {
            log.debug("Compiler '{}' is not available: {}", compiler, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolchainException("Interrupted while probing compiler " + compiler, e);
        }
    }

    static String readAll(InputStream stream) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append('\n');
            }
        }
        return output.toString();
    }
}
