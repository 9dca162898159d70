package org.syntaxforge.cst.config;

/**
 * How many property bindings are updated when the child they reference is removed or replaced.
 */
public enum BindingUpdate {
    /** Every binding and every sequence slot that references the child. */
    ALL,
    /** Only the first binding found, in binding declaration order. */
    FIRST
}
