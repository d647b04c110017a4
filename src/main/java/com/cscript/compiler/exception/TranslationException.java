package com.cscript.compiler.exception;

import java.util.List;
import java.util.stream.Collectors;

import com.cscript.compiler.model.Diagnostic;

/**
 * Fatal unit-level failure carrying every diagnostic gathered before the abort.
 */
public class TranslationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient List<Diagnostic> diagnostics;

    public TranslationException(List<Diagnostic> diagnostics) {
        super(diagnostics.stream()
                .map(d -> d.format("line"))
                .collect(Collectors.joining(System.lineSeparator())));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
