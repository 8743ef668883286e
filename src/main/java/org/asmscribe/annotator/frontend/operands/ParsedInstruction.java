package org.asmscribe.annotator.frontend.operands;

import java.util.List;

/**
 * An instruction line split into mnemonic and operands.
 *
 * @param mnemonic    Mnemonic as written, prefixes such as {@code rep} removed.
 * @param operandText Everything after the mnemonic, comment removed, trimmed.
 * @param operands    Operands split at top-level commas, in source order.
 * @param syntax      Detected dialect.
 */
public record ParsedInstruction(String mnemonic, String operandText, List<String> operands, Syntax syntax) {

    public ParsedInstruction {
        operands = List.copyOf(operands);
    }

    /**
     * @return index of the destination operand: first in Intel syntax, last in AT&T syntax.
     */
    public int destinationIndex() {
        if (operands.isEmpty()) {
            return -1;
        }
        return syntax == Syntax.ATT ? operands.size() - 1 : 0;
    }
}
