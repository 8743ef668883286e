package org.asmscribe.annotator.config;

import java.util.List;
import java.util.Objects;

/**
 * Static text and switches for the documentation blocks around the annotated body.
 *
 * @param enabled        Whether the header block is rendered at all.
 * @param title          Banner title.
 * @param subtitle       Second banner line, may be empty.
 * @param description    Problem / algorithm description, one entry per line.
 * @param footer         Closing notes, one entry per line.
 * @param style          Banner style.
 * @param includeSummary Whether the header lists every function found in the body.
 */
public record HeaderMetadata(boolean enabled, String title, String subtitle, List<String> description,
                             List<String> footer, RenderStyle style, boolean includeSummary) {

    public HeaderMetadata {
        title = Objects.requireNonNullElse(title, "");
        subtitle = Objects.requireNonNullElse(subtitle, "");
        description = List.copyOf(description);
        footer = List.copyOf(footer);
        Objects.requireNonNull(style, "style");
    }

    public HeaderMetadata withEnabled(boolean value) {
        return new HeaderMetadata(value, title, subtitle, description, footer, style, includeSummary);
    }

    public HeaderMetadata withStyle(RenderStyle value) {
        return new HeaderMetadata(enabled, title, subtitle, description, footer, value, includeSummary);
    }

    public HeaderMetadata withSummary(boolean value) {
        return new HeaderMetadata(enabled, title, subtitle, description, footer, style, value);
    }
}
