package org.pragmatica.optgen.compiler;

import org.pragmatica.optgen.ast.Expr;
import org.pragmatica.optgen.ast.Expr.ConstructExpr;
import org.pragmatica.optgen.ast.Expr.MatchExpr;
import org.pragmatica.optgen.error.Diagnostic;
import org.pragmatica.optgen.error.DiagnosticReporter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves operator names and variable labels in parsed rules and produces the compiled rule set.
 *
 * <p>Match names resolve to a define ({@code Not} becomes {@code NotOp}) or, failing that, to a
 * tag, which expands to every define carrying it in declaration order. Construct names must
 * name a define. Labels are scoped to their rule: a {@code $label} reference must follow the
 * {@code $label:pattern} bind in left-to-right order, and binds under a negation are not
 * visible outside it.
 *
 * <p>The parsed rules are left untouched; compilation builds new nodes.
 */
public final class RuleCompiler {
    public static final String OP_SUFFIX = "Op";

    private final DefineTable defines;
    private final DiagnosticReporter reporter;

    private RuleCompiler(DefineTable defines, DiagnosticReporter reporter) {
        this.defines = defines;
        this.reporter = reporter;
    }

    public static Expr.RuleSet compile(Expr.RuleSet rules, DefineTable defines, DiagnosticReporter reporter) {
        var compiler = new RuleCompiler(defines, reporter);
        var seen = new HashMap<String, Expr.Rule>();
        var compiled = new ArrayList<Expr.Rule>();

        for (var rule : rules.rules()) {
            var first = seen.putIfAbsent(rule.name(), rule);
            if (first != null) {
                reporter.report(Diagnostic.error(Diagnostic.Category.SEMANTIC,
                                                 "duplicate '" + rule.name() + "' rule statement",
                                                 rule.src())
                                          .withNote("'" + rule.name() + "' was first defined at " + first.src()));
            }
            compiled.add(compiler.compileRule(rule));
        }

        return new Expr.RuleSet(compiled);
    }

    public static String opName(Expr.Define define) {
        return define.name() + OP_SUFFIX;
    }

    private Expr.Rule compileRule(Expr.Rule rule) {
        var labels = new HashSet<String>();
        var match = compileMatch(rule.match(), labels);
        var replace = compileConstruct(rule.replace(), labels);
        return new Expr.Rule(rule.name(), rule.tags(), match, replace, rule.src());
    }

    // === Match side ===

    private MatchExpr compileMatch(MatchExpr expr, Set<String> labels) {
        if (expr instanceof Expr.Match match) {
            return compileOpMatch(match, labels);
        }
        if (expr instanceof Expr.MatchAnd and) {
            var left = compileMatch(and.left(), labels);
            var right = compileMatch(and.right(), labels);
            return new Expr.MatchAnd(left, right, and.src());
        }
        if (expr instanceof Expr.MatchNot not) {
            // Binds under a negation never reach the replace side
            var input = compileMatch(not.input(), new HashSet<>(labels));
            return new Expr.MatchNot(input, not.src());
        }
        if (expr instanceof Expr.MatchList list) {
            return new Expr.MatchList(compileMatch(list.matchItem(), labels), list.src());
        }
        if (expr instanceof Expr.MatchInvoke invoke) {
            return new Expr.MatchInvoke(invoke.funcName(), compileMatchArgs(invoke.args(), labels), invoke.src());
        }
        if (expr instanceof Expr.Bind bind) {
            var target = compileMatch(bind.target(), labels);
            if (!labels.add(bind.label())) {
                reporter.error(Diagnostic.Category.RESOLUTION,
                               "duplicate bind label '" + bind.label() + "'",
                               bind.src());
            }
            return new Expr.Bind(bind.label(), target, bind.src());
        }
        if (expr instanceof Expr.Ref ref) {
            checkRef(ref, labels);
            return ref;
        }
        if (expr instanceof Expr.MatchAny || expr instanceof Expr.StringExpr || expr instanceof Expr.NumberExpr) {
            return expr;
        }
        throw new IllegalStateException("unhandled match expression: " + expr.kind());
    }

    private Expr.Match compileOpMatch(Expr.Match match, Set<String> labels) {
        var resolved = new LinkedHashMap<String, Expr.Define>();

        for (var name : match.names()
                             .names()) {
            var define = defines.lookup(name.name());
            if (define.isPresent()) {
                resolved.putIfAbsent(name.name(), define.get());
                continue;
            }
            var tagged = defines.withTag(name.name());
            if (tagged.isEmpty()) {
                reporter.error(Diagnostic.Category.RESOLUTION,
                               "'" + name.name() + "' is not an operator name or tag",
                               match.src());
            }
            for (var taggedDefine : tagged) {
                resolved.putIfAbsent(taggedDefine.name(), taggedDefine);
            }
        }

        checkMatchArity(match, resolved);

        var names = resolved.values()
                            .stream()
                            .map(RuleCompiler::opName)
                            .toList();
        return new Expr.Match(Expr.OpNames.of(names), compileMatchArgs(match.args(), labels), match.src());
    }

    private void checkMatchArity(Expr.Match match, Map<String, Expr.Define> resolved) {
        int found = match.args()
                         .size();
        for (var define : resolved.values()) {
            int expected = define.fields()
                                 .size();
            if (found > expected) {
                reporter.error(Diagnostic.Category.RESOLUTION,
                               "too many arguments to '" + define.name() + "' match: found " + found
                               + ", expected at most " + expected,
                               match.src());
                return;
            }
        }
    }

    private List<MatchExpr> compileMatchArgs(List<MatchExpr> args, Set<String> labels) {
        var compiled = new ArrayList<MatchExpr>(args.size());
        for (var arg : args) {
            compiled.add(compileMatch(arg, labels));
        }
        return compiled;
    }

    // === Replace side ===

    private ConstructExpr compileConstruct(ConstructExpr expr, Set<String> labels) {
        if (expr instanceof Expr.Construct construct) {
            return compileOpConstruct(construct, labels);
        }
        if (expr instanceof Expr.ConstructList list) {
            return new Expr.ConstructList(compileConstructArgs(list.items(), labels), list.src());
        }
        if (expr instanceof Expr.Ref ref) {
            checkRef(ref, labels);
            return ref;
        }
        if (expr instanceof Expr.StringExpr || expr instanceof Expr.NumberExpr) {
            return expr;
        }
        throw new IllegalStateException("unhandled construct expression: " + expr.kind());
    }

    private Expr.Construct compileOpConstruct(Expr.Construct construct, Set<String> labels) {
        var name = construct.opName()
                            .name();
        var define = defines.lookup(name);
        var opName = construct.opName();

        if (define.isEmpty()) {
            reporter.error(Diagnostic.Category.RESOLUTION,
                           "'" + name + "' is not an operator name",
                           construct.src());
        } else {
            int found = construct.args()
                                 .size();
            int expected = define.get()
                                 .fields()
                                 .size();
            if (found != expected) {
                reporter.error(Diagnostic.Category.RESOLUTION,
                               "wrong number of arguments to '" + name + "' construct: found " + found
                               + ", expected " + expected,
                               construct.src());
            }
            opName = new Expr.OpName(opName(define.get()));
        }

        return new Expr.Construct(opName, compileConstructArgs(construct.args(), labels), construct.src());
    }

    private List<ConstructExpr> compileConstructArgs(List<ConstructExpr> args, Set<String> labels) {
        var compiled = new ArrayList<ConstructExpr>(args.size());
        for (var arg : args) {
            compiled.add(compileConstruct(arg, labels));
        }
        return compiled;
    }

    private void checkRef(Expr.Ref ref, Set<String> labels) {
        if (!labels.contains(ref.label())) {
            reporter.error(Diagnostic.Category.RESOLUTION,
                           "unrecognized variable name '" + ref.label() + "'",
                           ref.src());
        }
    }
}
