package org.asmscribe.annotator.config;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The calling convention in force: which register carries which argument, plus free-form
 * notes about other registers for the header legend (return value, stack pointer, ...).
 * <p>
 * Register names are stored in lower case without the AT&T {@code %} sigil.
 *
 * @param name      Convention name, e.g. {@code Windows x64}.
 * @param registers Argument registers and their roles.
 * @param notes     Legend entries for registers that are not argument carriers.
 */
public record ArgumentConvention(String name, Map<String, ArgumentRole> registers, Map<String, String> notes) {

    public ArgumentConvention {
        Objects.requireNonNull(name, "name");
        registers = normalizeKeys(registers);
        notes = normalizeKeys(notes);
    }

    /**
     * Looks up the argument role of a register. Accepts {@code RDX}, {@code rdx} and {@code %rdx}.
     *
     * @param register The register name as written in the operand.
     * @return the role, or empty if the register is not an argument register.
     */
    public Optional<ArgumentRole> roleOf(String register) {
        if (register == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registers.get(normalizeRegister(register)));
    }

    /**
     * @return argument registers ordered integer/pointer first, then floating-point, each by index.
     */
    public List<Map.Entry<String, ArgumentRole>> orderedRegisters() {
        return registers.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<String, ArgumentRole> e) -> e.getValue().floatingPoint())
                        .thenComparingInt(e -> e.getValue().index()))
                .collect(Collectors.toList());
    }

    public static String normalizeRegister(String register) {
        String r = register.trim();
        if (r.startsWith("%")) {
            r = r.substring(1);
        }
        return r.toLowerCase(Locale.ROOT);
    }

    private static <V> Map<String, V> normalizeKeys(Map<String, V> source) {
        Map<String, V> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(normalizeRegister(k), Objects.requireNonNull(v)));
        return Collections.unmodifiableMap(copy);
    }
}
