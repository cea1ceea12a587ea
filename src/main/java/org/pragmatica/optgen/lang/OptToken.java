package org.pragmatica.optgen.lang;

import org.pragmatica.optgen.tree.SourceSpan;

/**
 * Token types produced by {@link OptLexer}.
 */
public sealed interface OptToken {
    SourceSpan span();

    // Identifiers and literals
    record Identifier(SourceSpan span, String name) implements OptToken {}

    record StringLiteral(SourceSpan span, String value) implements OptToken {}

    record Number(SourceSpan span, long value) implements OptToken {}

    record Comment(SourceSpan span, String text) implements OptToken {}

    // Operators
    record Arrow(SourceSpan span) implements OptToken {}

    // =>
    record Colon(SourceSpan span) implements OptToken {}

    // :
    record Dollar(SourceSpan span) implements OptToken {}

    // $
    record Star(SourceSpan span) implements OptToken {}

    // *
    record Ampersand(SourceSpan span) implements OptToken {}

    // &
    record Caret(SourceSpan span) implements OptToken {}

    // ^
    record Pipe(SourceSpan span) implements OptToken {}

    // |
    record Ellipsis(SourceSpan span) implements OptToken {}

    // ...
    // Delimiters
    record LParen(SourceSpan span) implements OptToken {}

    record RParen(SourceSpan span) implements OptToken {}

    record LBracket(SourceSpan span) implements OptToken {}

    record RBracket(SourceSpan span) implements OptToken {}

    record LBrace(SourceSpan span) implements OptToken {}

    record RBrace(SourceSpan span) implements OptToken {}

    record Comma(SourceSpan span) implements OptToken {}

    // Special
    record Eof(SourceSpan span) implements OptToken {}

    record Error(SourceSpan span, String message) implements OptToken {}
}
