package org.asmscribe.annotator.api;

import java.util.Objects;

/**
 * One physical line of the input exactly as it was read.
 *
 * @param lineNumber 1-based line number in the source.
 * @param text       The line text without its line terminator.
 */
public record RawLine(int lineNumber, String text) {

    public RawLine {
        Objects.requireNonNull(text, "text");
        if (lineNumber < 1) {
            throw new IllegalArgumentException("Line numbers start at 1, got: " + lineNumber);
        }
    }
}
