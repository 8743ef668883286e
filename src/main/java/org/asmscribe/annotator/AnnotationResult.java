package org.asmscribe.annotator;

import org.asmscribe.annotator.api.FunctionContext;
import org.asmscribe.annotator.diagnostics.Diagnostic;

import java.nio.charset.Charset;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one annotation run.
 *
 * @param text        The rendered document.
 * @param diagnostics Everything reported during the run, in report order.
 * @param functions   Functions found in the input, in order.
 * @param charset     Charset of the input; encode {@code text} with it to keep the original bytes.
 */
public record AnnotationResult(String text, List<Diagnostic> diagnostics, List<FunctionContext> functions,
                               Charset charset) {

    public AnnotationResult {
        Objects.requireNonNull(charset, "charset");
        diagnostics = List.copyOf(diagnostics);
        functions = List.copyOf(functions);
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.WARNING);
    }
}
