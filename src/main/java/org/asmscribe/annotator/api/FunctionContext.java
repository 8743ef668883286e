package org.asmscribe.annotator.api;

/**
 * The function body a line belongs to.
 * <p>
 * Contexts compare by identity: every function body gets a fresh instance, so two
 * bodies that happen to share a display name are still distinct contexts. Only the
 * boundary tracker opens and closes them.
 */
public final class FunctionContext {

    private final String sourceSpelling;
    private final String displayName;
    private final int startLine;
    private boolean open = true;

    public FunctionContext(String sourceSpelling, String displayName, int startLine) {
        this.sourceSpelling = sourceSpelling;
        this.displayName = displayName;
        this.startLine = startLine;
    }

    /**
     * @return the symbol as the compiler spelled it on the declaration line.
     */
    public String sourceSpelling() {
        return sourceSpelling;
    }

    /**
     * @return the human-readable name resolved through the symbol table.
     */
    public String displayName() {
        return displayName;
    }

    public int startLine() {
        return startLine;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Marks the context closed. Idempotent.
     */
    public void close() {
        this.open = false;
    }

    @Override
    public String toString() {
        return "FunctionContext[" + displayName + " @" + startLine + (open ? ", open" : ", closed") + "]";
    }
}
