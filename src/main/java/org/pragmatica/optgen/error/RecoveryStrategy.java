package org.pragmatica.optgen.error;

/**
 * Syntax error recovery strategy.
 */
public enum RecoveryStrategy {
    /**
     * Stop parsing at the first syntax error.
     */
    NONE,

    /**
     * Drop the broken statement, resynchronize at the next statement boundary
     * and keep parsing, collecting every independent error.
     */
    STATEMENT
}
