package org.asmscribe.annotator.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one annotation run.
 * <p>
 * Everything the annotator can trip over is recoverable, so there is no error severity:
 * callers inspect {@link #hasWarnings()} or the individual entries after the pass.
 * <p>
 * Thread Safety: Not thread-safe. Use one engine per run.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void reportInfo(DiagnosticKind kind, String message, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.INFO, kind, message, lineNumber));
    }

    public void reportWarning(DiagnosticKind kind, String message, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, kind, message, lineNumber));
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.WARNING);
    }

    public long count(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).count();
    }

    /**
     * @return an unmodifiable view of all diagnostics in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
                .collect(Collectors.toList());
    }

    /**
     * Builds a one-line-per-kind overview followed by every warning, suitable for a console.
     *
     * @return the summary text, or an empty string when nothing was reported.
     */
    public String summary() {
        return summarize(diagnostics);
    }

    /**
     * Same as {@link #summary()} for diagnostics collected elsewhere.
     */
    public static String summarize(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        Map<DiagnosticKind, Long> counts = new EnumMap<>(DiagnosticKind.class);
        for (Diagnostic d : diagnostics) {
            counts.merge(d.kind(), 1L, Long::sum);
        }
        StringBuilder sb = new StringBuilder();
        counts.forEach((kind, count) -> sb.append(kind).append(": ").append(count).append('\n'));
        for (Diagnostic d : diagnostics) {
            if (d.severity() == Diagnostic.Severity.WARNING) {
                sb.append(d).append('\n');
            }
        }
        return sb.toString();
    }
}
