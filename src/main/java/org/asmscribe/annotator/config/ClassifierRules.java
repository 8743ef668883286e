package org.asmscribe.annotator.config;

import java.util.List;

/**
 * Textual patterns the line classifier and instruction parser recognize.
 *
 * @param ignoredDirectives        Prefixes of directives dropped from the output.
 * @param functionStartDirectives  Declaration directives that open a function, e.g. {@code .globl}.
 * @param functionEndMarkers       Substrings that mark the end of a function body.
 * @param commentPrefixes          Prefixes of assembler comments ({@code #}, {@code ;}).
 */
public record ClassifierRules(List<String> ignoredDirectives, List<String> functionStartDirectives,
                              List<String> functionEndMarkers, List<String> commentPrefixes) {

    public ClassifierRules {
        ignoredDirectives = List.copyOf(ignoredDirectives);
        functionStartDirectives = List.copyOf(functionStartDirectives);
        functionEndMarkers = List.copyOf(functionEndMarkers);
        commentPrefixes = List.copyOf(commentPrefixes);
    }

    /**
     * Rules matching clang and MSVC-flavoured x86-64 output.
     */
    public static ClassifierRules defaults() {
        return new ClassifierRules(
                List.of(".file", ".def", ".scl", ".type", ".endef", ".set", "@feat.00"),
                List.of(".globl", ".global"),
                List.of("# -- End function"),
                List.of("#", ";", "//"));
    }
}
