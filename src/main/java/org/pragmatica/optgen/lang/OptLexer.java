package org.pragmatica.optgen.lang;

import org.pragmatica.optgen.tree.SourceLocation;
import org.pragmatica.optgen.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the rule-definition language.
 *
 * <p>Tokens are produced on demand by {@link #next()}. Malformed input yields an
 * {@link OptToken.Error} token and scanning continues, so one pass can surface several
 * independent problems. After the end of input every call returns {@link OptToken.Eof}.
 */
public final class OptLexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private final String file;
    private int pos;
    private int line;
    private int column;

    private OptLexer(String input, String file) {
        this.input = input;
        this.file = file;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static OptLexer create(String input, String file) {
        return new OptLexer(input, file);
    }

    /**
     * Scan the whole input. The last token is always {@link OptToken.Eof}.
     */
    public static List<OptToken> tokenize(String input, String file) {
        var lexer = create(input, file);
        var tokens = new ArrayList<OptToken>();
        OptToken token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (!(token instanceof OptToken.Eof));
        return tokens;
    }

    public OptToken next() {
        skipWhitespace();
        if (isAtEnd()) {
            return new OptToken.Eof(SourceSpan.at(currentLocation()));
        }
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (c == '"') {
            return scanStringLiteral(start);
        }
        if (c == '#') {
            return scanComment(start);
        }
        return scanOperator(start);
    }

    private OptToken scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new OptToken.Identifier(span(start), sb.toString());
    }

    private OptToken scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        try{
            return new OptToken.Number(span(start), Long.parseLong(sb.toString()));
        } catch (NumberFormatException e) {
            return new OptToken.Error(span(start), "number literal out of range");
        }
    }

    private OptToken scanStringLiteral(SourceLocation start) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"' && peek() != '\n') {
            if (peek() == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) != '\n') {
                advance();
                sb.append(scanEscapeSequence());
            }else {
                sb.append(advance());
            }
        }
        if (isAtEnd() || peek() == '\n') {
            // Resume at the line break
            return new OptToken.Error(span(start), "unterminated string literal");
        }
        advance();
        // skip closing quote
        return new OptToken.StringLiteral(span(start), sb.toString());
    }

    private char scanEscapeSequence() {
        char c = advance();
        return switch (c) {
            case'n' -> '\n';
            case't' -> '\t';
            default -> c;
        };
    }

    private OptToken scanComment(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '\n') {
            sb.append(advance());
        }
        return new OptToken.Comment(span(start), sb.toString());
    }

    private OptToken scanOperator(SourceLocation start) {
        int codePoint = input.codePointAt(pos);
        if (Character.isSupplementaryCodePoint(codePoint)) {
            advance();
            advance();
            return unexpected(start, codePoint);
        }
        char c = advance();
        return switch (c) {
            case'(' -> new OptToken.LParen(span(start));
            case')' -> new OptToken.RParen(span(start));
            case'[' -> new OptToken.LBracket(span(start));
            case']' -> new OptToken.RBracket(span(start));
            case'{' -> new OptToken.LBrace(span(start));
            case'}' -> new OptToken.RBrace(span(start));
            case',' -> new OptToken.Comma(span(start));
            case':' -> new OptToken.Colon(span(start));
            case'$' -> new OptToken.Dollar(span(start));
            case'*' -> new OptToken.Star(span(start));
            case'&' -> new OptToken.Ampersand(span(start));
            case'^' -> new OptToken.Caret(span(start));
            case'|' -> new OptToken.Pipe(span(start));
            case'=' -> {
                if (!isAtEnd() && peek() == '>') {
                    advance();
                    yield new OptToken.Arrow(span(start));
                }
                yield unexpected(start, c);
            }
            case'.' -> {
                if (input.startsWith("..", pos)) {
                    advance();
                    advance();
                    yield new OptToken.Ellipsis(span(start));
                }
                yield unexpected(start, c);
            }
            default -> unexpected(start, c);
        };
    }

    private OptToken unexpected(SourceLocation start, int codePoint) {
        return new OptToken.Error(span(start), "unexpected character '" + Character.toString(codePoint) + "'");
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    /**
     * Consume one char. Columns count code points, so the low half of a surrogate pair does not
     * move the column.
     */
    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        }else if (!isTrailingSurrogate(c)) {
            column++ ;
        }
        return c;
    }

    private boolean isTrailingSurrogate(char c) {
        return Character.isLowSurrogate(c) && pos >= 2 && Character.isHighSurrogate(input.charAt(pos - 2));
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(file, line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
