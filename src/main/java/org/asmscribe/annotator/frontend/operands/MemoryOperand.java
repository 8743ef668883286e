package org.asmscribe.annotator.frontend.operands;

/**
 * A decoded memory reference, {@code [base + index*scale + displacement]} or
 * {@code displacement(base, index, scale)}.
 *
 * @param base         Base register in lower case without {@code %}, or {@code null}.
 * @param index        Index register, or {@code null}.
 * @param scale        Index scale, 1 when there is no index.
 * @param displacement Constant byte offset (sum of all numeric terms).
 * @param symbol       Symbolic displacement such as {@code __real@3ff0000000000000}, or {@code null}.
 * @param syntax       Dialect the operand was written in.
 */
public record MemoryOperand(String base, String index, int scale, long displacement, String symbol, Syntax syntax) {

    /**
     * @return {@code true} for the plain {@code base + constant} form, the only one that can
     *         be matched against a record layout.
     */
    public boolean isBaseDisplacement() {
        return base != null && index == null && symbol == null;
    }
}
