package org.asmscribe.annotator.frontend.lexer;

import java.util.List;

/**
 * Small text helpers shared by the classifier and the instruction parser.
 */
public final class AsmText {

    private AsmText() {
    }

    /**
     * Removes a trailing assembler comment, e.g. the {@code # @main} clang appends to labels.
     * A comment prefix only counts outside double quotes and at the start of the text or
     * after whitespace, so {@code "??H@YA?AUPoint@@"} and {@code $LN3@main} stay intact.
     *
     * @param text           Line text.
     * @param commentPrefixes Recognized comment prefixes.
     * @return the text before the comment, right-trimmed.
     */
    public static String stripTrailingComment(String text, List<String> commentPrefixes) {
        boolean inQuotes = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
                continue;
            }
            if (inQuotes || (i > 0 && !Character.isWhitespace(text.charAt(i - 1)))) {
                continue;
            }
            for (String prefix : commentPrefixes) {
                if (text.startsWith(prefix, i)) {
                    return text.substring(0, i).stripTrailing();
                }
            }
        }
        return text.stripTrailing();
    }

    /**
     * Strips one pair of surrounding double quotes, as clang emits around MSVC-mangled names.
     */
    public static String unquote(String symbol) {
        if (symbol.length() >= 2 && symbol.startsWith("\"") && symbol.endsWith("\"")) {
            return symbol.substring(1, symbol.length() - 1);
        }
        return symbol;
    }

    /**
     * @return {@code true} if {@code text} starts with {@code word} followed by whitespace or the end.
     */
    static boolean startsWithWord(String text, String word) {
        if (!text.startsWith(word)) {
            return false;
        }
        return text.length() == word.length() || Character.isWhitespace(text.charAt(word.length()));
    }
}
