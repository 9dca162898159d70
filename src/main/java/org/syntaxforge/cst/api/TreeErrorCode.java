package org.syntaxforge.cst.api;

/**
 * Defines unique, testable error codes for contract violations on the syntax tree.
 * This decouples the test logic from the translated error messages.
 */
public enum TreeErrorCode {
    /** The referenced node is not linked under the composite it was passed to. */
    NOT_A_CHILD("tree.error.notAChild"),
    /** The node to insert already has a parent. */
    ALREADY_ATTACHED("tree.error.alreadyAttached"),
    /** A composite without children was reached where a token was expected. */
    EMPTY_SUBTREE("tree.error.emptySubtree"),
    /** The operation would make a node its own ancestor. */
    SELF_REFERENCE("tree.error.selfReference"),
    /** A node-level operation needs a parent but the node is detached. */
    NO_PARENT("tree.error.noParent");

    private final String messageKey;

    TreeErrorCode(String messageKey) {
        this.messageKey = messageKey;
    }

    /**
     * @return The key of the message template in the {@code tree_messages} bundle.
     */
    public String messageKey() {
        return messageKey;
    }
}
