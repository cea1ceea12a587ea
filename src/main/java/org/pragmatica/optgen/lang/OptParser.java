package org.pragmatica.optgen.lang;

import org.pragmatica.optgen.ast.Expr;
import org.pragmatica.optgen.ast.Expr.ConstructExpr;
import org.pragmatica.optgen.ast.Expr.MatchExpr;
import org.pragmatica.optgen.error.Diagnostic;
import org.pragmatica.optgen.error.DiagnosticReporter;
import org.pragmatica.optgen.error.RecoveryStrategy;
import org.pragmatica.optgen.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for rule-definition files.
 *
 * <p>Grammar:
 * <pre>
 * root      := (define | rule)* EOF
 * define    := ('[' IDENT (',' IDENT)* ']')? 'define' IDENT '{' (IDENT IDENT)* '}'
 * rule      := '[' IDENT (',' IDENT)* ']' matchFunc ('&amp;' predicate)* '=&gt;' construct
 * match     := unary ('&amp;' predicate)*
 * unary     := '^' unary | matchFunc | '$' IDENT (':' unary)? | '*'
 *            | '[' '...' match '...' ']' | STRING | NUMBER
 * matchFunc := '(' IDENT ('|' IDENT)* match* ')'
 * predicate := '^' predicate | '(' IDENT ('$' IDENT | STRING | NUMBER)* ')'
 * construct := '(' IDENT construct* ')' | '[' construct* ']' | '$' IDENT | STRING | NUMBER
 * </pre>
 *
 * <p>Syntax errors are reported to the {@link DiagnosticReporter}; the broken statement is
 * dropped and, with {@link RecoveryStrategy#STATEMENT}, parsing resumes at the next statement
 * boundary. The returned tree holds every statement that parsed cleanly. Patterns and
 * constructs nested more than 256 levels deep are rejected as syntax errors.
 */
public final class OptParser {
    private static final String DEFINE_KEYWORD = "define";
    private static final int MAX_NESTING_DEPTH = 256;

    private final String source;
    private final OptLexer lexer;
    private final DiagnosticReporter reporter;
    private final RecoveryStrategy recovery;
    private OptToken current;
    private OptToken lookahead;
    private int previousLine;
    private int depth;

    private OptParser(String source, String file, DiagnosticReporter reporter, RecoveryStrategy recovery) {
        this.source = source;
        this.lexer = OptLexer.create(source, file);
        this.reporter = reporter;
        this.recovery = recovery;
        this.current = nextSignificant();
        this.previousLine = 0;
    }

    public static Expr.Root parse(String source, String file, RecoveryStrategy recovery, DiagnosticReporter reporter) {
        return new OptParser(source, file, reporter, recovery).parseRoot();
    }

    private Expr.Root parseRoot() {
        var defines = new ArrayList<Expr.Define>();
        var rules = new ArrayList<Expr.Rule>();

        while (!isAtEnd()) {
            int statementStart = offset();
            depth = 0;
            try{
                parseStatement(defines, rules);
            } catch (SyntaxError e) {
                reporter.report(e.diagnostic());
                if (recovery == RecoveryStrategy.NONE) {
                    break;
                }
                var failedAt = peek();
                if (offset() == statementStart) {
                    advance();
                }
                synchronize(failedAt);
            }
        }

        return new Expr.Root(new Expr.DefineSet(defines), new Expr.RuleSet(rules));
    }

    private void parseStatement(List<Expr.Define> defines, List<Expr.Rule> rules) {
        var start = location();

        if (isDefineKeyword(peek())) {
            defines.add(parseDefine(Expr.Tags.EMPTY, start));
            return;
        }

        if (peek() instanceof OptToken.LBracket) {
            var names = parseHeaderNames();
            if (isDefineKeyword(peek())) {
                defines.add(parseDefine(Expr.Tags.of(names), start));
            }else {
                rules.add(parseRule(names, start));
            }
            return;
        }

        throw unexpected("define statement or rule");
    }

    private List<String> parseHeaderNames() {
        expect(OptToken.LBracket.class, "'['");
        var names = new ArrayList<String>();
        names.add(expectIdentifier("rule name or tag"));
        while (peek() instanceof OptToken.Comma) {
            advance();
            names.add(expectIdentifier("tag"));
        }
        expect(OptToken.RBracket.class, "',' or ']'");
        return names;
    }

    // === Defines ===

    private Expr.Define parseDefine(Expr.Tags tags, SourceLocation start) {
        advance(); // skip 'define'
        var name = expectIdentifier("define name");
        expect(OptToken.LBrace.class, "'{'");

        var fields = new ArrayList<Expr.DefineField>();
        while (!(peek() instanceof OptToken.RBrace)) {
            if (!(peek() instanceof OptToken.Identifier)) {
                throw unexpected("field name or '}'");
            }
            var fieldStart = location();
            var fieldName = expectIdentifier("field name");
            var fieldType = expectIdentifier("field type");
            fields.add(new Expr.DefineField(fieldName, fieldType, fieldStart));
        }
        advance(); // skip '}'

        return new Expr.Define(tags, name, new Expr.DefineFields(fields), start);
    }

    // === Rules ===

    private Expr.Rule parseRule(List<String> header, SourceLocation start) {
        var name = header.get(0);
        var tags = Expr.Tags.of(header.subList(1, header.size()));

        if (!(peek() instanceof OptToken.LParen)) {
            throw unexpected("'(' to start the match pattern");
        }
        var matchStart = location();
        var match = parsePredicates(parseMatchFunc(), matchStart);

        expect(OptToken.Arrow.class, "'=>'");
        var replace = parseConstruct();

        return new Expr.Rule(name, tags, match, replace, start);
    }

    // === Match patterns ===

    private MatchExpr parseMatch() {
        var start = location();
        return parsePredicates(parseMatchUnary(), start);
    }

    private MatchExpr parsePredicates(MatchExpr left, SourceLocation start) {
        var result = left;
        while (peek() instanceof OptToken.Ampersand) {
            advance();
            result = new Expr.MatchAnd(result, parsePredicate(), start);
        }
        return result;
    }

    private MatchExpr parseMatchUnary() {
        enterNested();
        try{
            var start = location();
            if (peek() instanceof OptToken.Caret) {
                advance();
                return new Expr.MatchNot(parseMatchUnary(), start);
            }
            return parseMatchPrimary();
        } finally {
            depth-- ;
        }
    }

    private MatchExpr parseMatchPrimary() {
        var token = peek();
        var start = location();

        if (token instanceof OptToken.LParen) {
            return parseMatchFunc();
        }

        if (token instanceof OptToken.Dollar) {
            advance();
            var label = expectIdentifier("variable name");
            if (peek() instanceof OptToken.Colon) {
                advance();
                return new Expr.Bind(label, parseMatchUnary(), start);
            }
            return new Expr.Ref(label, start);
        }

        if (token instanceof OptToken.Star) {
            advance();
            return new Expr.MatchAny(start);
        }

        if (token instanceof OptToken.LBracket) {
            advance();
            expect(OptToken.Ellipsis.class, "'...'");
            var item = parseMatch();
            expect(OptToken.Ellipsis.class, "'...'");
            expect(OptToken.RBracket.class, "']'");
            return new Expr.MatchList(item, start);
        }

        if (token instanceof OptToken.StringLiteral str) {
            advance();
            return new Expr.StringExpr(str.value());
        }

        if (token instanceof OptToken.Number num) {
            advance();
            return new Expr.NumberExpr(num.value());
        }

        throw unexpected("match pattern");
    }

    private Expr.Match parseMatchFunc() {
        var start = location();
        expect(OptToken.LParen.class, "'('");

        var names = new ArrayList<String>();
        names.add(expectIdentifier("operator name"));
        while (peek() instanceof OptToken.Pipe) {
            advance();
            names.add(expectIdentifier("operator name"));
        }

        var args = new ArrayList<MatchExpr>();
        while (!(peek() instanceof OptToken.RParen)) {
            args.add(parseMatch());
        }
        advance(); // skip ')'

        return new Expr.Match(Expr.OpNames.of(names), args, start);
    }

    private MatchExpr parsePredicate() {
        var start = location();
        if (peek() instanceof OptToken.Caret) {
            advance();
            enterNested();
            try{
                return new Expr.MatchNot(parsePredicate(), start);
            } finally {
                depth-- ;
            }
        }

        expect(OptToken.LParen.class, "'(' to start a predicate call");
        var funcName = expectIdentifier("function name");
        var args = new ArrayList<MatchExpr>();
        while (!(peek() instanceof OptToken.RParen)) {
            args.add(parseInvokeArg());
        }
        advance(); // skip ')'

        return new Expr.MatchInvoke(funcName, args, start);
    }

    private MatchExpr parseInvokeArg() {
        var token = peek();
        var start = location();

        if (token instanceof OptToken.Dollar) {
            advance();
            return new Expr.Ref(expectIdentifier("variable name"), start);
        }
        if (token instanceof OptToken.StringLiteral str) {
            advance();
            return new Expr.StringExpr(str.value());
        }
        if (token instanceof OptToken.Number num) {
            advance();
            return new Expr.NumberExpr(num.value());
        }

        throw unexpected("variable, string or number argument");
    }

    // === Replace expressions ===

    private ConstructExpr parseConstruct() {
        enterNested();
        try{
            return parseConstructPrimary();
        } finally {
            depth-- ;
        }
    }

    private ConstructExpr parseConstructPrimary() {
        var token = peek();
        var start = location();

        if (token instanceof OptToken.LParen) {
            advance();
            var name = expectIdentifier("operator name");
            var args = new ArrayList<ConstructExpr>();
            while (!(peek() instanceof OptToken.RParen)) {
                args.add(parseConstruct());
            }
            advance(); // skip ')'
            return new Expr.Construct(new Expr.OpName(name), args, start);
        }

        if (token instanceof OptToken.LBracket) {
            advance();
            var items = new ArrayList<ConstructExpr>();
            while (!(peek() instanceof OptToken.RBracket)) {
                items.add(parseConstruct());
            }
            advance(); // skip ']'
            return new Expr.ConstructList(items, start);
        }

        if (token instanceof OptToken.Dollar) {
            advance();
            return new Expr.Ref(expectIdentifier("variable name"), start);
        }

        if (token instanceof OptToken.StringLiteral str) {
            advance();
            return new Expr.StringExpr(str.value());
        }

        if (token instanceof OptToken.Number num) {
            advance();
            return new Expr.NumberExpr(num.value());
        }

        throw unexpected("replace expression");
    }

    // === Recovery ===

    /**
     * Skip to the next statement boundary: a {@code define} keyword, or a {@code [} followed by a
     * name, that is the first token on its line; or the end of input. Lexical errors passed over
     * on the way are still reported, except the token the statement failed at.
     */
    private void synchronize(OptToken failedAt) {
        while (!isAtEnd() && !isStatementBoundary(peek())) {
            if (peek() instanceof OptToken.Error error && error != failedAt) {
                reporter.error(Diagnostic.Category.LEXICAL, error.message(), error.span());
            }
            advance();
        }
    }

    private boolean isStatementBoundary(OptToken token) {
        if (token.span().start().line() <= previousLine) {
            return false;
        }
        // A '[' opening a list pattern or list construct is followed by '...' or an item, never a name
        return isDefineKeyword(token)
               || (token instanceof OptToken.LBracket && peekNext() instanceof OptToken.Identifier);
    }

    private void enterNested() {
        if (++depth > MAX_NESTING_DEPTH) {
            throw new SyntaxError(Diagnostic.error(Diagnostic.Category.SYNTAX,
                                                   "expression nested too deeply",
                                                   peek().span()));
        }
    }

    // === Token stream ===

    private OptToken nextSignificant() {
        var token = lexer.next();
        while (token instanceof OptToken.Comment) {
            token = lexer.next();
        }
        return token;
    }

    private boolean isAtEnd() {
        return current instanceof OptToken.Eof;
    }

    private OptToken peek() {
        return current;
    }

    private OptToken peekNext() {
        if (lookahead == null) {
            lookahead = nextSignificant();
        }
        return lookahead;
    }

    private void advance() {
        if (!isAtEnd()) {
            previousLine = current.span().end().line();
            if (lookahead != null) {
                current = lookahead;
                lookahead = null;
            }else {
                current = nextSignificant();
            }
        }
    }

    private <T extends OptToken> T expect(Class<T> tokenClass, String expected) {
        if (tokenClass.isInstance(peek())) {
            var token = tokenClass.cast(peek());
            advance();
            return token;
        }
        throw unexpected(expected);
    }

    private String expectIdentifier(String expected) {
        return expect(OptToken.Identifier.class, expected).name();
    }

    private static boolean isDefineKeyword(OptToken token) {
        return token instanceof OptToken.Identifier id && DEFINE_KEYWORD.equals(id.name());
    }

    private SourceLocation location() {
        return peek().span().start();
    }

    private int offset() {
        return location().offset();
    }

    private SyntaxError unexpected(String expected) {
        var token = peek();
        if (token instanceof OptToken.Error error) {
            return new SyntaxError(Diagnostic.error(Diagnostic.Category.LEXICAL, error.message(), error.span()));
        }
        return new SyntaxError(Diagnostic.error(Diagnostic.Category.SYNTAX,
                                                "expected " + expected + ", found " + describe(token),
                                                token.span()));
    }

    private String describe(OptToken token) {
        if (token instanceof OptToken.Identifier id) {
            return "'" + id.name() + "'";
        }
        if (token instanceof OptToken.StringLiteral) {
            return "string literal";
        }
        if (token instanceof OptToken.Number num) {
            return "number " + num.value();
        }
        if (token instanceof OptToken.Eof) {
            return "end of file";
        }
        return "'" + token.span()
                          .extract(source) + "'";
    }

    /**
     * Unwinds a statement that failed to parse.
     */
    private static final class SyntaxError extends RuntimeException {
        private final transient Diagnostic diagnostic;

        SyntaxError(Diagnostic diagnostic) {
            super(diagnostic.message(), null, false, false);
            this.diagnostic = diagnostic;
        }

        Diagnostic diagnostic() {
            return diagnostic;
        }
    }
}
