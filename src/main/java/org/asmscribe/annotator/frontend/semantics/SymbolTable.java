package org.asmscribe.annotator.frontend.semantics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exact-match mapping from compiler symbol spellings to display names.
 * <p>
 * Lookups are case-sensitive and compare whole spellings only. A spelling that merely
 * contains a registered one (or is contained by it) does not match: {@code ??H@YA} must
 * never rename {@code ??H@YA?AUPoint@@AEBU0@0@Z} or vice versa. Unmatched spellings
 * resolve to themselves.
 * <p>
 * Thread Safety: populate once, then share read-only. Concurrent {@link #register} calls
 * are not supported.
 */
public class SymbolTable {

    private final Map<String, SymbolEntry> entries = new LinkedHashMap<>();

    public SymbolTable() {
    }

    public SymbolTable(Collection<SymbolEntry> initial) {
        initial.forEach(this::register);
    }

    /**
     * Registers a function symbol. See {@link #register(SymbolEntry)}.
     */
    public void register(String sourceSpelling, String displayName) {
        register(new SymbolEntry(sourceSpelling, displayName, SymbolRole.FUNCTION));
    }

    /**
     * Inserts or overwrites an entry. Registering the same pair twice changes nothing;
     * a different display name for a known spelling replaces the old one.
     *
     * @param entry The entry to register.
     */
    public void register(SymbolEntry entry) {
        entries.put(entry.sourceSpelling(), entry);
    }

    /**
     * Resolves a spelling to its display name.
     *
     * @param sourceSpelling The spelling to resolve.
     * @return the registered display name, or {@code sourceSpelling} unchanged if unknown.
     */
    public String resolve(String sourceSpelling) {
        SymbolEntry entry = entries.get(sourceSpelling);
        return entry != null ? entry.displayName() : sourceSpelling;
    }

    /**
     * @param sourceSpelling The spelling to look up.
     * @return the entry for exactly this spelling, or empty.
     */
    public Optional<SymbolEntry> lookup(String sourceSpelling) {
        return Optional.ofNullable(entries.get(sourceSpelling));
    }

    public boolean contains(String sourceSpelling) {
        return entries.containsKey(sourceSpelling);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return a snapshot of all entries in registration order.
     */
    public List<SymbolEntry> entries() {
        return new ArrayList<>(entries.values());
    }
}
