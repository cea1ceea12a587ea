package org.pragmatica.optgen.ast;

import org.pragmatica.optgen.tree.SourceLocation;

import java.util.List;
import java.util.Optional;

/**
 * Nodes of a parsed or compiled rule-definition file.
 *
 * <p>Every node reports its {@link ExprKind}; structural walks (printing, equality of shape)
 * go through {@link #kind()} and {@link #children()} only. For {@link Shape#REF} kinds the
 * children line up with {@link ExprKind#fieldNames()}, for {@link Shape#SLICE} kinds they are
 * the elements, and {@link Shape#VALUE} kinds have none.
 */
public sealed interface Expr {

    ExprKind kind();

    default List<Expr> children() {
        return List.of();
    }

    /**
     * Where the node was written. Nodes built outside the parser may have no location.
     */
    default Optional<SourceLocation> source() {
        return Optional.empty();
    }

    /**
     * Pattern tested against an expression tree.
     */
    sealed interface MatchExpr extends Expr {}

    /**
     * Recipe for building a replacement tree.
     */
    sealed interface ConstructExpr extends Expr {}

    /**
     * Wrapped primitive.
     */
    sealed interface ValueExpr extends Expr {
        String text();

        default boolean quoted() {
            return true;
        }
    }

    // === Top level ===

    record Root(DefineSet defines, RuleSet rules) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.ROOT;
        }

        @Override
        public List<Expr> children() {
            return List.of(defines, rules);
        }
    }

    record DefineSet(List<Define> defines) implements Expr {
        public DefineSet {
            defines = List.copyOf(defines);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.DEFINE_SET;
        }

        @Override
        public List<Expr> children() {
            return List.copyOf(defines);
        }
    }

    record RuleSet(List<Rule> rules) implements Expr {
        public RuleSet {
            rules = List.copyOf(rules);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.RULE_SET;
        }

        @Override
        public List<Expr> children() {
            return List.copyOf(rules);
        }
    }

    // === Defines ===

    /**
     * Declaration of one operator type: {@code [Tags] define Name { Field Type ... }}
     */
    record Define(Tags tags, String name, DefineFields fields, SourceLocation src) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.DEFINE;
        }

        @Override
        public List<Expr> children() {
            return List.of(tags, new StringExpr(name), fields);
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }

        public boolean hasTag(String tag) {
            return tags.contains(tag);
        }
    }

    record DefineFields(List<DefineField> fields) implements Expr {
        public DefineFields {
            fields = List.copyOf(fields);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.DEFINE_FIELDS;
        }

        @Override
        public List<Expr> children() {
            return List.copyOf(fields);
        }

        public int size() {
            return fields.size();
        }
    }

    record DefineField(String name, String type, SourceLocation src) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.DEFINE_FIELD;
        }

        @Override
        public List<Expr> children() {
            return List.of(new StringExpr(name), new StringExpr(type));
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    record Tags(List<Tag> tags) implements Expr {
        public static final Tags EMPTY = new Tags(List.of());

        public Tags {
            tags = List.copyOf(tags);
        }

        public static Tags of(List<String> names) {
            return new Tags(names.stream()
                                 .map(Tag::new)
                                 .toList());
        }

        @Override
        public ExprKind kind() {
            return ExprKind.TAGS;
        }

        @Override
        public List<Expr> children() {
            return List.copyOf(tags);
        }

        public boolean contains(String name) {
            return tags.stream()
                       .anyMatch(tag -> tag.name()
                                           .equals(name));
        }
    }

    record Tag(String name) implements ValueExpr {
        @Override
        public ExprKind kind() {
            return ExprKind.TAG;
        }

        @Override
        public String text() {
            return name;
        }
    }

    // === Rules ===

    /**
     * Rewrite rule: {@code [Name, Tags] (match) => replace}
     */
    record Rule(String name, Tags tags, MatchExpr match, ConstructExpr replace, SourceLocation src) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.RULE;
        }

        @Override
        public List<Expr> children() {
            return List.of(new StringExpr(name), tags, match, replace);
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    // === Match patterns ===

    /**
     * Operator match: {@code (Name | Name2 arg...)}
     */
    record Match(OpNames names, List<MatchExpr> args, SourceLocation src) implements MatchExpr {
        public Match {
            args = List.copyOf(args);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.MATCH;
        }

        @Override
        public List<Expr> children() {
            return List.of(names, ExprList.of(args));
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    /**
     * Conjunction: {@code left & right}
     */
    record MatchAnd(MatchExpr left, MatchExpr right, SourceLocation src) implements MatchExpr {
        @Override
        public ExprKind kind() {
            return ExprKind.MATCH_AND;
        }

        @Override
        public List<Expr> children() {
            return List.of(left, right);
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    /**
     * Negation: {@code ^input}
     */
    record MatchNot(MatchExpr input, SourceLocation src) implements MatchExpr {
        @Override
        public ExprKind kind() {
            return ExprKind.MATCH_NOT;
        }

        @Override
        public List<Expr> children() {
            return List.of(input);
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    /**
     * Wildcard: {@code *}
     */
    record MatchAny(SourceLocation src) implements MatchExpr {
        @Override
        public ExprKind kind() {
            return ExprKind.MATCH_ANY;
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    /**
     * Any list item matches: {@code [ ... item ... ]}
     */
    record MatchList(MatchExpr matchItem, SourceLocation src) implements MatchExpr {
        @Override
        public ExprKind kind() {
            return ExprKind.MATCH_LIST;
        }

        @Override
        public List<Expr> children() {
            return List.of(matchItem);
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    /**
     * Call of an externally defined predicate: {@code & (FuncName arg...)}
     */
    record MatchInvoke(String funcName, List<MatchExpr> args, SourceLocation src) implements MatchExpr {
        public MatchInvoke {
            args = List.copyOf(args);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.MATCH_INVOKE;
        }

        @Override
        public List<Expr> children() {
            return List.of(new StringExpr(funcName), ExprList.of(args));
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    /**
     * Capture: {@code $label:target}
     */
    record Bind(String label, MatchExpr target, SourceLocation src) implements MatchExpr {
        @Override
        public ExprKind kind() {
            return ExprKind.BIND;
        }

        @Override
        public List<Expr> children() {
            return List.of(new StringExpr(label), target);
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    /**
     * Reference to a captured sub-tree: {@code $label}
     */
    record Ref(String label, SourceLocation src) implements MatchExpr, ConstructExpr {
        @Override
        public ExprKind kind() {
            return ExprKind.REF;
        }

        @Override
        public List<Expr> children() {
            return List.of(new StringExpr(label));
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    // === Construction ===

    /**
     * Operator construction: {@code (OpName arg...)}
     */
    record Construct(OpName opName, List<ConstructExpr> args, SourceLocation src) implements ConstructExpr {
        public Construct {
            args = List.copyOf(args);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.CONSTRUCT;
        }

        @Override
        public List<Expr> children() {
            return List.of(opName, ExprList.of(args));
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    /**
     * List construction: {@code [item...]}
     */
    record ConstructList(List<ConstructExpr> items, SourceLocation src) implements ConstructExpr {
        public ConstructList {
            items = List.copyOf(items);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.CONSTRUCT_LIST;
        }

        @Override
        public List<Expr> children() {
            return List.of(ExprList.of(items));
        }

        @Override
        public Optional<SourceLocation> source() {
            return Optional.ofNullable(src);
        }
    }

    // === Names, lists and literals ===

    /**
     * Alternation of operator names; a match succeeds on any of them.
     */
    record OpNames(List<OpName> names) implements Expr {
        public OpNames {
            names = List.copyOf(names);
        }

        public static OpNames of(List<String> names) {
            return new OpNames(names.stream()
                                    .map(OpName::new)
                                    .toList());
        }

        @Override
        public ExprKind kind() {
            return ExprKind.OP_NAMES;
        }

        @Override
        public List<Expr> children() {
            return List.copyOf(names);
        }
    }

    record OpName(String name) implements ValueExpr {
        @Override
        public ExprKind kind() {
            return ExprKind.OP_NAME;
        }

        @Override
        public String text() {
            return name;
        }

        @Override
        public boolean quoted() {
            return false;
        }
    }

    /**
     * Argument list of a match, invocation or construction.
     */
    record ExprList(List<Expr> items) implements Expr {
        public ExprList {
            items = List.copyOf(items);
        }

        public static ExprList of(List<? extends Expr> items) {
            return new ExprList(List.copyOf(items));
        }

        @Override
        public ExprKind kind() {
            return ExprKind.LIST;
        }

        @Override
        public List<Expr> children() {
            return items;
        }
    }

    record StringExpr(String value) implements ValueExpr, MatchExpr, ConstructExpr {
        @Override
        public ExprKind kind() {
            return ExprKind.STRING;
        }

        @Override
        public String text() {
            return value;
        }
    }

    record NumberExpr(long value) implements ValueExpr, MatchExpr, ConstructExpr {
        @Override
        public ExprKind kind() {
            return ExprKind.NUMBER;
        }

        @Override
        public String text() {
            return Long.toString(value);
        }

        @Override
        public boolean quoted() {
            return false;
        }
    }
}
