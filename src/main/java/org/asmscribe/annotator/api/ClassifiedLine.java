package org.asmscribe.annotator.api;

import java.util.Objects;

/**
 * A {@link RawLine} together with its {@link LineTag}.
 */
public record ClassifiedLine(RawLine raw, LineTag tag) {

    public ClassifiedLine {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(tag, "tag");
    }

    public int lineNumber() {
        return raw.lineNumber();
    }

    public String text() {
        return raw.text();
    }
}
