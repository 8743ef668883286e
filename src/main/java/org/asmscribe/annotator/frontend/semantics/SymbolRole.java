package org.asmscribe.annotator.frontend.semantics;

/**
 * What a symbol table entry names.
 */
public enum SymbolRole {
    FUNCTION,
    UNKNOWN
}
