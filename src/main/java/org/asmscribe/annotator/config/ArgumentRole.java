package org.asmscribe.annotator.config;

import java.util.Objects;

/**
 * Role of an argument register under a calling convention.
 *
 * @param index         1-based argument position.
 * @param floatingPoint Whether the register carries floating-point arguments.
 * @param note          Optional remark shown in comments (e.g. {@code result}), empty if none.
 */
public record ArgumentRole(int index, boolean floatingPoint, String note) {

    public ArgumentRole {
        if (index < 1) {
            throw new IllegalArgumentException("Argument index starts at 1, got: " + index);
        }
        note = Objects.requireNonNullElse(note, "");
    }

    /**
     * Renders the role the way comments refer to it, e.g. {@code 1st argument (result)}
     * or {@code 2nd floating-point argument}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(ordinal(index));
        sb.append(floatingPoint ? " floating-point argument" : " argument");
        if (!note.isEmpty()) {
            sb.append(" (").append(note).append(')');
        }
        return sb.toString();
    }

    static String ordinal(int n) {
        int mod100 = n % 100;
        if (mod100 >= 11 && mod100 <= 13) {
            return n + "th";
        }
        return switch (n % 10) {
            case 1 -> n + "st";
            case 2 -> n + "nd";
            case 3 -> n + "rd";
            default -> n + "th";
        };
    }
}
