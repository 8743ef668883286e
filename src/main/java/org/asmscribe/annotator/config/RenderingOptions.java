package org.asmscribe.annotator.config;

/**
 * Layout of the annotated body.
 *
 * @param commentColumn Column (0-based, after indentation) at which instruction comments start.
 * @param indent        Number of spaces instructions are indented by.
 */
public record RenderingOptions(int commentColumn, int indent) {

    public RenderingOptions {
        if (commentColumn < 0 || indent < 0) {
            throw new IllegalArgumentException("commentColumn and indent must not be negative");
        }
    }
}
