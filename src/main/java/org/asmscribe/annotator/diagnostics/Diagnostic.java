package org.asmscribe.annotator.diagnostics;

/**
 * A single message collected during an annotation pass.
 *
 * @param severity   How serious the condition is.
 * @param kind       What happened.
 * @param message    Human-readable description.
 * @param lineNumber 1-based source line, or 0 when the condition is not tied to a line.
 */
public record Diagnostic(Severity severity, DiagnosticKind kind, String message, int lineNumber) {

    public enum Severity {
        INFO,
        WARNING
    }

    @Override
    public String toString() {
        String location = lineNumber > 0 ? "line " + lineNumber + ": " : "";
        return severity + " " + location + message;
    }
}
