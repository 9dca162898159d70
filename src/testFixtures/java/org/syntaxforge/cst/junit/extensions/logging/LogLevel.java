package org.syntaxforge.cst.junit.extensions.logging;

/**
 * Log levels that tests can allow or expect.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
