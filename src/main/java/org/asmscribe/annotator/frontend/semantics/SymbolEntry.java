package org.asmscribe.annotator.frontend.semantics;

import java.util.Objects;

/**
 * Maps one compiler-produced spelling to the name a reader should see.
 *
 * @param sourceSpelling The mangled or truncated spelling, matched exactly.
 * @param displayName    The human-readable replacement.
 * @param role           What the symbol names.
 */
public record SymbolEntry(String sourceSpelling, String displayName, SymbolRole role) {

    public SymbolEntry {
        Objects.requireNonNull(sourceSpelling, "sourceSpelling");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(role, "role");
        if (sourceSpelling.isEmpty()) {
            throw new IllegalArgumentException("Symbol spelling must not be empty");
        }
    }
}
