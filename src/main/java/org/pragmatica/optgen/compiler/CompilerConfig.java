package org.pragmatica.optgen.compiler;

import org.pragmatica.optgen.error.DiagnosticReporter;
import org.pragmatica.optgen.error.RecoveryStrategy;

/**
 * Compiler configuration options.
 *
 * @param errorLimit       number of diagnostics rendered in full before the summary line
 * @param recoveryStrategy what the parser does after a syntax error
 */
public record CompilerConfig(
    int errorLimit,
    RecoveryStrategy recoveryStrategy
) {
    public static final CompilerConfig DEFAULT = new CompilerConfig(
        DiagnosticReporter.DEFAULT_LIMIT,
        RecoveryStrategy.STATEMENT
    );

    public CompilerConfig {
        if (errorLimit < 0) {
            throw new IllegalArgumentException("errorLimit must not be negative: " + errorLimit);
        }
    }
}
