package org.pragmatica.optgen;

import org.pragmatica.optgen.ast.Expr;
import org.pragmatica.optgen.compiler.CompileResult;
import org.pragmatica.optgen.compiler.CompilerConfig;
import org.pragmatica.optgen.compiler.OptCompiler;
import org.pragmatica.optgen.error.DiagnosticReporter;
import org.pragmatica.optgen.error.RecoveryStrategy;
import org.pragmatica.optgen.printer.ExprPrinter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point for compiling rule-definition files.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = Optgen.compile("""
 *     define Not { Input Expr }
 *
 *     [EliminateNot]
 *     (Not (Not $input:*)) => $input
 *     """, "not.opt");
 *
 * if (result instanceof CompileResult.Success success) {
 *     System.out.print(Optgen.print(success.root()));
 * }
 * }</pre>
 */
public final class Optgen {
    private Optgen() {}

    /**
     * Compile source text with the default configuration.
     */
    public static CompileResult compile(String source, String filename) {
        return OptCompiler.create(CompilerConfig.DEFAULT)
                          .compile(source, filename);
    }

    /**
     * Read and compile a UTF-8 file. Locations carry the path as given.
     */
    public static CompileResult compile(Path file) throws IOException {
        return compile(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    /**
     * Parse source text without validation or name resolution.
     */
    public static Expr.Root parse(String source, String filename, DiagnosticReporter reporter) {
        return OptCompiler.create(CompilerConfig.DEFAULT)
                          .parse(source, filename, reporter);
    }

    /**
     * Canonical rendering with source locations.
     */
    public static String print(Expr expr) {
        return ExprPrinter.withSource()
                          .print(expr);
    }

    /**
     * Create a builder for a non-default compiler.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int errorLimit = CompilerConfig.DEFAULT.errorLimit();
        private RecoveryStrategy recoveryStrategy = CompilerConfig.DEFAULT.recoveryStrategy();

        private Builder() {}

        public Builder errorLimit(int limit) {
            this.errorLimit = limit;
            return this;
        }

        public Builder recovery(RecoveryStrategy strategy) {
            this.recoveryStrategy = strategy;
            return this;
        }

        public OptCompiler build() {
            return OptCompiler.create(new CompilerConfig(errorLimit, recoveryStrategy));
        }
    }
}
