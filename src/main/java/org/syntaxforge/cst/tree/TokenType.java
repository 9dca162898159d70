package org.syntaxforge.cst.tree;

/**
 * Categories of leaf tokens. The tree only uses them for matching; the lexer decides them.
 */
public enum TokenType {
    /** Spaces, tabs and line breaks. */
    WHITESPACE,
    /** A line or block comment, including its delimiters. */
    COMMENT,
    /** A name, such as a variable or function name. */
    IDENTIFIER,
    /** A reserved word of the language. */
    KEYWORD,
    /** A numeric literal. */
    NUMBER,
    /** A string literal, including its quotes. */
    STRING,
    /** An operator such as {@code +} or {@code ==}. */
    OPERATOR,
    /** Delimiters such as parentheses, braces and separators. */
    PUNCTUATION,
    /** Anything the lexer could not categorize. */
    UNKNOWN;

    /**
     * @return {@code true} for tokens that carry no meaning for the program.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }
}
