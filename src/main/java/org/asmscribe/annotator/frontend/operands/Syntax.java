package org.asmscribe.annotator.frontend.operands;

import java.util.List;

/**
 * Assembly dialect of an instruction. Decides operand order and memory syntax.
 */
public enum Syntax {
    /** {@code mov rax, qword ptr [rdx + 8]}: destination first. */
    INTEL,
    /** {@code movq 8(%rdx), %rax}: destination last. */
    ATT;

    /**
     * AT&T operands carry {@code %} register or {@code $} immediate sigils; anything else is Intel.
     *
     * @param operandText Everything after the mnemonic.
     * @param operands    The same text split into operands.
     * @return the detected dialect.
     */
    public static Syntax detect(String operandText, List<String> operands) {
        return operandText.contains("%") || operands.stream().anyMatch(o -> o.startsWith("$")) ? ATT : INTEL;
    }
}
