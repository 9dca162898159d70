package org.syntaxforge.cst.api;

import org.syntaxforge.cst.internal.i18n.Messages;

/**
 * Thrown when an operation would break the structure of a syntax tree.
 * <p>
 * All checks run before the tree is touched, so the tree is unchanged when this is thrown.
 * These are programming errors on the caller side and are never worth retrying.
 */
public class TreeStructureException extends RuntimeException {

    private final TreeErrorCode code;

    /**
     * Constructs a new exception with a message looked up for the given code.
     * @param code The error code.
     * @param args The arguments for the message template.
     */
    public TreeStructureException(TreeErrorCode code, Object... args) {
        super(Messages.get(code.messageKey(), args));
        this.code = code;
    }

    /**
     * @return The error code identifying the violated precondition.
     */
    public TreeErrorCode getCode() {
        return code;
    }
}
