package org.pragmatica.optgen.error;

import org.pragmatica.optgen.tree.SourceLocation;
import org.pragmatica.optgen.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates diagnostics from every compiler phase in discovery order.
 *
 * <p>One reporter is owned by one compile invocation and is not shared between threads.
 */
public final class DiagnosticReporter {
    public static final int DEFAULT_LIMIT = 2;

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void error(Diagnostic.Category category, String message, SourceSpan span) {
        report(Diagnostic.error(category, message, span));
    }

    public void error(Diagnostic.Category category, String message, SourceLocation location) {
        report(Diagnostic.error(category, message, location));
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public int count() {
        return diagnostics.size();
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public List<String> render(int limit) {
        return render(diagnostics, limit);
    }

    /**
     * Render at most {@code limit} diagnostics in single-line form, followed by a summary
     * line counting the ones left out.
     */
    public static List<String> render(List<Diagnostic> diagnostics, int limit) {
        var lines = new ArrayList<String>();
        int shown = Math.min(Math.max(limit, 0), diagnostics.size());
        for (int i = 0; i < shown; i++) {
            lines.add(diagnostics.get(i).formatSimple());
        }
        if (diagnostics.size() > shown) {
            lines.add(tooManyErrors(diagnostics.size() - shown));
        }
        return lines;
    }

    public static String tooManyErrors(int remaining) {
        return "... too many errors (" + remaining + " more)";
    }
}
