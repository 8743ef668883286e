package org.asmscribe.annotator.api;

/**
 * Classification of a physical assembly line.
 */
public enum LineTag {
    /** Assembler bookkeeping directive that carries no meaning for a reader (dropped on output). */
    DIRECTIVE,
    /** Declaration directive opening a function, e.g. {@code .globl main}. */
    FUNCTION_START,
    /** A bare label such as {@code main:} or {@code .LBB0_2:}. */
    LABEL,
    /** Compiler-emitted end-of-function sentinel. */
    FUNCTION_END,
    /** Everything else that is not blank. */
    INSTRUCTION,
    /** Empty or whitespace-only line. */
    BLANK
}
