package org.asmscribe.annotator.backend.render;

import org.asmscribe.annotator.config.RenderStyle;

import java.util.List;

/**
 * Comment banners shared by the header, footer and function blocks.
 */
final class Banners {

    static final int WIDTH = 80;

    private Banners() {
    }

    /**
     * A full-width rule, {@code ; ====...} in plain style or {@code ; +----...+} in box style.
     */
    static String rule(RenderStyle style, char fill) {
        if (style == RenderStyle.BOX) {
            return "; +" + String.valueOf(fill).repeat(WIDTH - 4) + "+";
        }
        return "; " + String.valueOf(fill).repeat(WIDTH - 2);
    }

    /**
     * Frames the given lines. Plain style centers them between two rules; box style pads
     * them into a bordered box.
     */
    static void frame(RenderStyle style, List<String> lines, List<String> out) {
        out.add(rule(style, '='));
        for (String line : lines) {
            if (style == RenderStyle.BOX) {
                out.add("; | " + center(line, WIDTH - 6) + " |");
            } else {
                out.add("; " + center(line, WIDTH - 2).stripTrailing());
            }
        }
        out.add(rule(style, '='));
    }

    /**
     * Prefixes a text line as a comment. Empty text yields a bare {@code ;}.
     */
    static String comment(String text) {
        return text.isEmpty() ? ";" : "; " + text;
    }

    private static String center(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        int left = (width - text.length()) / 2;
        return " ".repeat(left) + text + " ".repeat(width - text.length() - left);
    }
}
