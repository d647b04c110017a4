package com.cscript.compiler.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One structured diagnostic: source line (0 when not tied to a line), kind, severity and message.
 */
@Value
@Builder
public class Diagnostic {

    public enum Severity {
        ERROR,
        WARNING
    }

    int line;

    @NonNull
    DiagnosticKind kind;

    @NonNull
    Severity severity;

    @NonNull
    String message;

    public static Diagnostic error(int line, DiagnosticKind kind, String message) {
        return new Diagnostic(line, kind, Severity.ERROR, message);
    }

    public static Diagnostic warning(int line, DiagnosticKind kind, String message) {
        return new Diagnostic(line, kind, Severity.WARNING, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Renders the diagnostic as {@code unit:line: kind: message}.
     */
    public String format(String unitName) {
        StringBuilder sb = new StringBuilder(unitName);
        if (line > 0) {
            sb.append(':').append(line);
        }
        sb.append(": ");
        if (severity == Severity.WARNING) {
            sb.append("warning: ");
        }
        sb.append(kind.getCode()).append(": ").append(message);
        return sb.toString();
    }
}
