package org.syntaxforge.cst.api;

/**
 * A position in the source code, as recorded by the lexer for a token.
 * The tree never interprets it; it only hands it back to callers.
 *
 * @param fileName The file where the token is located.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourcePosition(String fileName, int lineNumber, int columnNumber) {

    /** Position reported by nodes that have no token to point at. */
    public static final SourcePosition UNKNOWN = new SourcePosition("<unknown>", 0, 0);

    /**
     * Creates a position in an anonymous in-memory source.
     * @param lineNumber The 1-based line number.
     * @param columnNumber The 1-based column number.
     * @return The position.
     */
    public static SourcePosition at(int lineNumber, int columnNumber) {
        return new SourcePosition("<memory>", lineNumber, columnNumber);
    }

    /**
     * @return {@code true} unless this is {@link #UNKNOWN}.
     */
    public boolean isKnown() {
        return lineNumber > 0;
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}
