package org.asmscribe.annotator.diagnostics;

/**
 * Recoverable conditions the annotation pass reports. None of them aborts a run.
 */
public enum DiagnosticKind {
    /** Symbol spelling not present in the symbol table; the spelling is kept as is. */
    UNRESOLVED_SYMBOL,
    /** Mnemonic not present in the opcode table; the line gets an explicit unclassified tag. */
    UNKNOWN_OPCODE,
    /** Memory offset through an argument pointer that matches no field of the record layout. */
    OFFSET_OUTSIDE_LAYOUT,
    /** A function start was seen while another function body was still open. */
    NESTED_FUNCTION,
    /** Input ended while a function body was open. */
    UNTERMINATED_FUNCTION,
    /** An end-of-function marker appeared outside any function body. */
    STRAY_FUNCTION_END
}
