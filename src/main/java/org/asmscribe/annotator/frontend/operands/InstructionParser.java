package org.asmscribe.annotator.frontend.operands;

import org.asmscribe.annotator.frontend.lexer.AsmText;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Splits an instruction line into mnemonic and operands.
 */
public class InstructionParser {

    private static final Set<String> PREFIXES = Set.of("rep", "repe", "repz", "repne", "repnz", "lock", "notrack",
            "data16", "rex64");

    private final List<String> commentPrefixes;

    public InstructionParser(List<String> commentPrefixes) {
        this.commentPrefixes = List.copyOf(commentPrefixes);
    }

    /**
     * @param lineText Raw line text.
     * @return the parsed instruction, or empty for blank or comment-only text.
     */
    public Optional<ParsedInstruction> parse(String lineText) {
        String text = AsmText.stripTrailingComment(lineText.trim(), commentPrefixes);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        String[] words = text.split("\\s+", 2);
        String mnemonic = words[0];
        String rest = words.length > 1 ? words[1].trim() : "";
        while (PREFIXES.contains(mnemonic.toLowerCase(Locale.ROOT)) && !rest.isEmpty()) {
            words = rest.split("\\s+", 2);
            mnemonic = words[0];
            rest = words.length > 1 ? words[1].trim() : "";
        }
        List<String> operands = splitOperands(rest);
        return Optional.of(new ParsedInstruction(mnemonic, rest, operands, Syntax.detect(rest, operands)));
    }

    /**
     * Splits operand text at commas that are not inside brackets, parentheses or quotes.
     */
    static List<String> splitOperands(String operandText) {
        List<String> result = new ArrayList<>();
        if (operandText.isBlank()) {
            return result;
        }
        int depth = 0;
        boolean inQuotes = false;
        int start = 0;
        for (int i = 0; i < operandText.length(); i++) {
            char c = operandText.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (!inQuotes && (c == '[' || c == '(')) {
                depth++;
            } else if (!inQuotes && (c == ']' || c == ')')) {
                depth = Math.max(0, depth - 1);
            } else if (!inQuotes && depth == 0 && c == ',') {
                result.add(operandText.substring(start, i).trim());
                start = i + 1;
            }
        }
        result.add(operandText.substring(start).trim());
        return result;
    }
}
