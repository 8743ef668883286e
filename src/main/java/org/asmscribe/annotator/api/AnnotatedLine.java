package org.asmscribe.annotator.api;

import org.asmscribe.annotator.frontend.operands.SemanticTag;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of the annotator: the classified line, the function it belongs to (if any),
 * the semantic tags inferred for it and the composed comment text.
 *
 * @param line    The classified input line, never modified.
 * @param context The enclosing function, or {@code null} outside any function.
 * @param tags    Semantic tags in classification order (opcode class first).
 * @param comment The composed comment, or {@code null} if the line carries none.
 */
public record AnnotatedLine(ClassifiedLine line, FunctionContext context, List<SemanticTag> tags, String comment) {

    public AnnotatedLine {
        Objects.requireNonNull(line, "line");
        tags = List.copyOf(tags);
    }

    /**
     * Creates an annotated line without tags or comment.
     */
    public static AnnotatedLine plain(ClassifiedLine line, FunctionContext context) {
        return new AnnotatedLine(line, context, List.of(), null);
    }

    public Optional<FunctionContext> function() {
        return Optional.ofNullable(context);
    }

    public LineTag tag() {
        return line.tag();
    }

    public String text() {
        return line.text();
    }
}
