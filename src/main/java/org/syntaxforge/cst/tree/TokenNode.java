package org.syntaxforge.cst.tree;

import org.syntaxforge.cst.api.SourcePosition;

import java.util.Objects;

/**
 * A leaf of the syntax tree carrying a verbatim slice of the source.
 * Every byte of the input ends up in exactly one token, which is what makes
 * {@link CompositeNode#serialize()} reproduce the original text.
 */
public class TokenNode extends Node {

    private final TokenType type;
    private final String text;
    private final SourcePosition position;

    /**
     * @param type The category of the token.
     * @param text The exact text of the token from the source code.
     * @param position Where the token starts.
     */
    public TokenNode(TokenType type, String text, SourcePosition position) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = Objects.requireNonNull(text, "text");
        this.position = Objects.requireNonNull(position, "position");
    }

    /**
     * Creates a token that does not come from a parsed source, e.g. one synthesized by a transform.
     * @param type The category of the token.
     * @param text The text of the token.
     * @return The token.
     */
    public static TokenNode of(TokenType type, String text) {
        return new TokenNode(type, text, SourcePosition.UNKNOWN);
    }

    public TokenType getType() {
        return type;
    }

    @Override
    public SourcePosition getSourcePosition() {
        return position;
    }

    @Override
    public String toString() {
        return text;
    }

    @Override
    public String describe() {
        return type + "'" + text + "'@" + position;
    }
}
