package org.asmscribe.annotator.frontend.operands;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes memory references in Intel ({@code qword ptr [rdx + 8]}) and AT&T
 * ({@code 8(%rdx)}) notation. Operands that are not memory references yield empty.
 */
public final class MemoryOperandParser {

    private static final Pattern REGISTER = Pattern.compile(
            "(?i)r[a-d]x|r[sd]i|r[sb]p|r(?:[89]|1[0-5])[dwb]?|e[a-d]x|e[sd]i|e[sb]p|[a-d][lhx]|[sd]il|[sb]pl|[sd]i|[sb]p"
            + "|rip|eip|[xyz]mm(?:[0-9]|[12][0-9]|3[01])|[c-gs]s");

    private static final Pattern ATT_MEMORY = Pattern.compile(
            "^(?<disp>[^()]*)\\((?<base>%\\w+)?(?:\\s*,\\s*(?<index>%\\w+)(?:\\s*,\\s*(?<scale>\\d+))?)?\\s*\\)$");

    private static final Pattern NUMBER = Pattern.compile("(?i)^(?:0x[0-9a-f]+|[0-9][0-9a-f]*h|[0-9]+)$");

    private static final Pattern SYMBOL_PLUS_CONSTANT = Pattern.compile("^(.*?)([+-]\\s*\\d+)$");

    private static final Pattern SIZE_PTR = Pattern.compile(
            "(?i)\\b(byte|word|dword|qword|xmmword|ymmword|zmmword|tbyte|oword|real4|real8)\\s+ptr\\b");

    private static final Pattern SEGMENT = Pattern.compile("(?i)^[c-gs]s:");

    private MemoryOperandParser() {
    }

    /**
     * @param operand One operand, already split from its siblings.
     * @return the decoded reference, or empty if the operand is no memory reference.
     */
    public static Optional<MemoryOperand> parse(String operand) {
        String text = operand.trim();
        if (text.startsWith("*")) {
            text = text.substring(1).trim();
        }
        int open = text.indexOf('[');
        if (open >= 0 && text.endsWith("]")) {
            return parseIntel(text, open);
        }
        if (text.endsWith(")") && text.contains("(")) {
            return parseAtt(text);
        }
        return Optional.empty();
    }

    /**
     * @return {@code true} if the text names an x86-64 register (with or without {@code %}).
     */
    public static boolean isRegister(String text) {
        String t = text.trim();
        if (t.startsWith("%")) {
            t = t.substring(1);
        }
        return REGISTER.matcher(t).matches();
    }

    /**
     * Parses an integer literal: decimal, {@code 0x} hex or MASM {@code 0FFh} hex, with an
     * optional sign and AT&T {@code $} prefix.
     *
     * @return the value, or {@code null} if the text is no literal.
     */
    public static Long parseNumber(String text) {
        String t = text.trim();
        if (t.startsWith("$")) {
            t = t.substring(1);
        }
        boolean negative = false;
        if (t.startsWith("-") || t.startsWith("+")) {
            negative = t.startsWith("-");
            t = t.substring(1).trim();
        }
        if (!NUMBER.matcher(t).matches()) {
            return null;
        }
        try {
            long value;
            String lower = t.toLowerCase(Locale.ROOT);
            if (lower.startsWith("0x")) {
                value = Long.parseLong(lower.substring(2), 16);
            } else if (lower.endsWith("h")) {
                value = Long.parseLong(lower.substring(0, lower.length() - 1), 16);
            } else {
                value = Long.parseLong(lower);
            }
            return negative ? -value : value;
        } catch (NumberFormatException e) {
            // out of range for a long: not a displacement we can use
            return null;
        }
    }

    private static Optional<MemoryOperand> parseIntel(String text, int open) {
        String prefix = text.substring(0, open).trim();
        String inner = text.substring(open + 1, text.length() - 1);

        String base = null;
        String index = null;
        int scale = 1;
        long displacement = 0;
        StringBuilder symbol = new StringBuilder();

        // a symbol in front of the bracket (MSVC "p$[rsp]") acts as a symbolic displacement
        String prefixSymbol = stripSizeAndSegment(prefix);
        if (!prefixSymbol.isEmpty()) {
            symbol.append(prefixSymbol);
        }

        int sign = 1;
        int start = 0;
        for (int i = 0; i <= inner.length(); i++) {
            boolean end = i == inner.length();
            char c = end ? 0 : inner.charAt(i);
            if (end || c == '+' || c == '-') {
                String term = inner.substring(start, i).trim();
                if (!term.isEmpty()) {
                    if (term.contains("*")) {
                        String[] parts = term.split("\\*");
                        String left = parts[0].trim();
                        String right = parts.length > 1 ? parts[1].trim() : "";
                        Long leftNumber = parseNumber(left);
                        index = normalize(leftNumber != null ? right : left);
                        Long factor = leftNumber != null ? leftNumber : parseNumber(right);
                        scale = factor != null ? factor.intValue() : 1;
                    } else if (isRegister(term)) {
                        if (base == null) {
                            base = normalize(term);
                        } else if (index == null) {
                            index = normalize(term);
                        }
                    } else {
                        Long value = parseNumber(term);
                        if (value != null) {
                            displacement += sign * value;
                        } else {
                            if (symbol.length() > 0) {
                                symbol.append(sign < 0 ? "-" : "+");
                            }
                            symbol.append(term);
                        }
                    }
                }
                if (!end) {
                    sign = c == '-' ? -1 : 1;
                }
                start = i + 1;
            }
        }
        return Optional.of(new MemoryOperand(base, index, scale, displacement,
                symbol.length() > 0 ? symbol.toString() : null, Syntax.INTEL));
    }

    private static Optional<MemoryOperand> parseAtt(String text) {
        String t = text;
        int colon = t.indexOf(':');
        if (colon >= 0 && t.startsWith("%") && colon < t.indexOf('(')) {
            t = t.substring(colon + 1);
        }
        Matcher m = ATT_MEMORY.matcher(t.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        String base = m.group("base") != null ? normalize(m.group("base")) : null;
        String index = m.group("index") != null ? normalize(m.group("index")) : null;
        int scale = m.group("scale") != null ? Integer.parseInt(m.group("scale")) : 1;

        long displacement = 0;
        String symbol = null;
        String disp = m.group("disp").trim();
        if (!disp.isEmpty()) {
            Long value = parseNumber(disp);
            if (value != null) {
                displacement = value;
            } else {
                // symbol or symbol+constant
                Matcher split = SYMBOL_PLUS_CONSTANT.matcher(disp);
                if (split.matches() && !split.group(1).isBlank()) {
                    symbol = split.group(1).trim();
                    Long tail = parseNumber(split.group(2).replace(" ", ""));
                    displacement = tail != null ? tail : 0;
                } else {
                    symbol = disp;
                }
            }
        }
        return Optional.of(new MemoryOperand(base, index, scale, displacement, symbol, Syntax.ATT));
    }

    private static String stripSizeAndSegment(String prefix) {
        String p = SIZE_PTR.matcher(prefix).replaceAll("").trim();
        return SEGMENT.matcher(p).replaceFirst("").trim();
    }

    private static String normalize(String register) {
        String r = register.trim();
        if (r.startsWith("%")) {
            r = r.substring(1);
        }
        return r.toLowerCase(Locale.ROOT);
    }
}
