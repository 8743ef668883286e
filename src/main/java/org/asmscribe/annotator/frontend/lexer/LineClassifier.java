package org.asmscribe.annotator.frontend.lexer;

import org.asmscribe.annotator.api.ClassifiedLine;
import org.asmscribe.annotator.api.LineTag;
import org.asmscribe.annotator.api.RawLine;
import org.asmscribe.annotator.config.ClassifierRules;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns a {@link LineTag} to a physical line. Pure function of the trimmed text.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>ignorable directive prefix ({@code .file}, {@code .def}, ...) &rarr; {@link LineTag#DIRECTIVE};
 *       so is a declaration of an ignorable symbol such as {@code .globl @feat.00}</li>
 *   <li>function declaration directive ({@code .globl name}) &rarr; {@link LineTag#FUNCTION_START};
 *       bare label ({@code name:}) &rarr; {@link LineTag#LABEL}</li>
 *   <li>end-of-function sentinel &rarr; {@link LineTag#FUNCTION_END}</li>
 *   <li>any other non-blank text &rarr; {@link LineTag#INSTRUCTION}</li>
 *   <li>blank &rarr; {@link LineTag#BLANK}</li>
 * </ol>
 * Unrecognized text defaults to {@code INSTRUCTION}; nothing is ever thrown.
 */
public class LineClassifier {

    private static final Pattern BARE_LABEL = Pattern.compile("^(\"[^\"]+\"|[^\\s\":]+):$");

    private final ClassifierRules rules;

    public LineClassifier(ClassifierRules rules) {
        this.rules = rules;
    }

    public ClassifiedLine classify(RawLine line) {
        return new ClassifiedLine(line, classify(line.text()));
    }

    public LineTag classify(String rawText) {
        String text = rawText.trim();
        if (text.isEmpty()) {
            return LineTag.BLANK;
        }
        for (String prefix : rules.ignoredDirectives()) {
            if (text.startsWith(prefix)) {
                return LineTag.DIRECTIVE;
            }
        }
        if (declarationDirective(text) != null) {
            return declaresIgnoredSymbol(text) ? LineTag.DIRECTIVE : LineTag.FUNCTION_START;
        }
        if (labelName(text).isPresent()) {
            return LineTag.LABEL;
        }
        for (String marker : rules.functionEndMarkers()) {
            if (text.contains(marker)) {
                return LineTag.FUNCTION_END;
            }
        }
        return LineTag.INSTRUCTION;
    }

    /**
     * Extracts the symbol declared by a function declaration line.
     *
     * @param rawText Line text, e.g. {@code .globl "??H@YA?AUPoint@@AEBU0@0@Z"}.
     * @return the declared spelling without quotes, or empty if the line is no declaration
     *         or declares nothing.
     */
    public Optional<String> declaredName(String rawText) {
        String text = rawText.trim();
        String directive = declarationDirective(text);
        if (directive == null) {
            return Optional.empty();
        }
        String rest = AsmText.stripTrailingComment(text.substring(directive.length()), rules.commentPrefixes()).trim();
        if (rest.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(AsmText.unquote(rest));
    }

    /**
     * Extracts the name of a bare label line, ignoring a trailing comment.
     *
     * @param rawText Line text, e.g. {@code main:   # @main}.
     * @return the label without colon and quotes, or empty if the line is no bare label.
     */
    public Optional<String> labelName(String rawText) {
        String text = AsmText.stripTrailingComment(rawText.trim(), rules.commentPrefixes());
        Matcher m = BARE_LABEL.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(AsmText.unquote(m.group(1)));
    }

    public ClassifierRules rules() {
        return rules;
    }

    private boolean declaresIgnoredSymbol(String trimmed) {
        Optional<String> name = declaredName(trimmed);
        return name.isPresent() && rules.ignoredDirectives().stream().anyMatch(name.get()::startsWith);
    }

    private String declarationDirective(String trimmed) {
        for (String directive : rules.functionStartDirectives()) {
            if (AsmText.startsWithWord(trimmed, directive)) {
                return directive;
            }
        }
        return null;
    }
}
