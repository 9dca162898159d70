package org.syntaxforge.cst.diagnostics;

import org.syntaxforge.cst.api.SourcePosition;

/**
 * Represents a single finding about the structure of a syntax tree.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param position Where in the source the affected node starts.
 */
public record Diagnostic(
        Type type,
        String message,
        SourcePosition position
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A broken invariant; the tree can no longer be trusted. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, position, message);
    }
}
