package org.pragmatica.optgen.compiler;

import org.pragmatica.optgen.ast.Expr;
import org.pragmatica.optgen.error.Diagnostic;
import org.pragmatica.optgen.error.DiagnosticReporter;

import java.util.List;

/**
 * Outcome of compiling one source file: a compiled tree or a non-empty list of diagnostics,
 * never both.
 */
public sealed interface CompileResult {

    /**
     * The compiled source text, kept for rendering diagnostics with context.
     */
    String source();

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful compilation.
     */
    record Success(Expr.Root root, String source) implements CompileResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Failed compilation with diagnostics in discovery order.
     */
    record Failure(List<Diagnostic> diagnostics, String source) implements CompileResult {
        public Failure {
            if (diagnostics.isEmpty()) {
                throw new IllegalArgumentException("failure requires at least one diagnostic");
            }
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        /**
         * Single-line diagnostics capped at {@code limit}, plus the summary line if any were left out.
         */
        public List<String> summary(int limit) {
            return DiagnosticReporter.render(diagnostics, limit);
        }

        /**
         * Capped diagnostics, each with its source line and caret underline.
         */
        public String formatDiagnostics(int limit) {
            var sb = new StringBuilder();
            int shown = Math.min(limit, diagnostics.size());
            for (int i = 0; i < shown; i++) {
                sb.append(diagnostics.get(i)
                                     .format(source))
                  .append("\n");
            }
            if (diagnostics.size() > shown) {
                sb.append(DiagnosticReporter.tooManyErrors(diagnostics.size() - shown))
                  .append("\n");
            }
            return sb.toString();
        }

        public int errorCount() {
            return diagnostics.size();
        }
    }
}
