package org.asmscribe.annotator.frontend.operands;

import java.util.Objects;

/**
 * Table entry describing a mnemonic.
 *
 * @param action      What the instruction does.
 * @param width       Width of the data it operates on.
 * @param description Short human-readable description used as the general comment.
 */
public record OpcodeClass(Action action, DataWidth width, String description) {

    public OpcodeClass {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(description, "description");
    }

    OpcodeClass withWidth(DataWidth newWidth) {
        if (action == Action.CALL || action == Action.RETURN || action == Action.JUMP) {
            return new OpcodeClass(action, newWidth, description);
        }
        String text = description;
        if (width.isInteger() && newWidth != width) {
            text = description.replace(width.label(), newWidth.label());
        } else if (width == DataWidth.NONE && newWidth != DataWidth.NONE) {
            text = description + " (" + newWidth.label() + ")";
        }
        return new OpcodeClass(action, newWidth, text);
    }
}
