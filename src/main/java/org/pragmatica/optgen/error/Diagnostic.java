package org.pragmatica.optgen.error;

import org.pragmatica.optgen.tree.SourceLocation;
import org.pragmatica.optgen.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Positioned compile-time message produced by any phase of the compiler.
 *
 * <p>Single-line form, used by the command line tool:
 * <pre>
 * test.opt:2:1: duplicate 'Lt' define statement
 * </pre>
 *
 * <p>Source-context form:
 * <pre>
 * error: duplicate 'Lt' define statement
 *   --> test.opt:2:1
 *    |
 *  2 | define Lt {}
 *    | ^^^^^^
 *    |
 *    = note: 'Lt' was first defined at test.opt:1:1
 * </pre>
 *
 * @param severity Severity level
 * @param category Phase family that produced the diagnostic
 * @param message  Primary message
 * @param span     Source span the message points at
 * @param notes    Additional notes
 */
public record Diagnostic(
    Severity severity,
    Category category,
    String message,
    SourceSpan span,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Severity levels.
     */
    public enum Severity {
        ERROR("error");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * Error taxonomy: which kind of check rejected the input.
     */
    public enum Category {
        /** Malformed token or unterminated literal. */
        LEXICAL,
        /** Unexpected token or missing construct. */
        SYNTAX,
        /** Duplicate names, misplaced fields, malformed defines. */
        SEMANTIC,
        /** Unresolved operator names and variable labels. */
        RESOLUTION
    }

    public static Diagnostic error(Category category, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, category, message, span, List.of());
    }

    public static Diagnostic error(Category category, String message, SourceLocation location) {
        return error(category, message, SourceSpan.at(location));
    }

    public SourceLocation location() {
        return span.start();
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, category, message, span, newNotes);
    }

    /**
     * Single-line form: {@code file:line:col: message}.
     */
    public String formatSimple() {
        return location() + ": " + message;
    }

    /**
     * Format this diagnostic with the offending source line and a caret underline.
     *
     * @param source The source text the span refers to
     * @return Formatted diagnostic string
     */
    public String format(String source) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var loc = location();

        sb.append(severity.display()).append(": ").append(message).append("\n");
        sb.append("  --> ").append(loc).append("\n");

        int gutterWidth = String.valueOf(loc.line()).length();
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        if (loc.line() >= 1 && loc.line() <= lines.length) {
            var lineContent = lines[loc.line() - 1];
            sb.append(String.format("%" + gutterWidth + "d", loc.line()))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ")
              .append(" ".repeat(Math.max(0, loc.column() - 1)))
              .append("^".repeat(underlineLength(lineContent)))
              .append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= note: ").append(note).append("\n");
        }
        return sb.toString();
    }

    private int underlineLength(String lineContent) {
        var start = span.start();
        var end = span.end();
        int endColumn = end.line() == start.line()
                        ? end.column()
                        : lineContent.length() + 1;
        return Math.max(1, endColumn - start.column());
    }
}
