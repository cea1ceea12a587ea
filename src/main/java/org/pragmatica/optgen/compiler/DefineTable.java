package org.pragmatica.optgen.compiler;

import org.pragmatica.optgen.ast.Expr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Symbol table of one compile invocation: defines by name and by tag, in declaration order.
 * Only the first define of a given name is recorded.
 */
public final class DefineTable {
    public static final String PRIVATE_TAG = "Private";
    public static final String VALUE_TAG = "Value";
    public static final String SLICE_TAG = "Slice";

    public static final String EXPR_TYPE = "Expr";
    public static final String LIST_TYPE = "ExprList";
    public static final Set<String> PRIMITIVE_TYPES = Set.of("string", "int", "bool");
    public static final Set<String> BUILTIN_TYPES = Set.of(EXPR_TYPE, LIST_TYPE, "string", "int", "bool");

    private final Map<String, Expr.Define> byName = new LinkedHashMap<>();
    private final Map<String, List<Expr.Define>> byTag = new LinkedHashMap<>();

    DefineTable() {}

    /**
     * Record a define.
     *
     * @return the previously recorded define of the same name, if any; the table is unchanged then
     */
    Optional<Expr.Define> add(Expr.Define define) {
        var existing = byName.putIfAbsent(define.name(), define);
        if (existing != null) {
            return Optional.of(existing);
        }
        for (var tag : define.tags()
                             .tags()) {
            byTag.computeIfAbsent(tag.name(), key -> new ArrayList<>())
                 .add(define);
        }
        return Optional.empty();
    }

    public Optional<Expr.Define> lookup(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public List<Expr.Define> withTag(String tag) {
        return List.copyOf(byTag.getOrDefault(tag, List.of()));
    }

    public boolean isKnownType(String type) {
        return BUILTIN_TYPES.contains(type) || byName.containsKey(type);
    }

    /**
     * A field is private when its type is a define tagged {@code Private}.
     */
    public boolean isPrivateType(String type) {
        return lookup(type).map(define -> define.hasTag(PRIVATE_TAG))
                           .orElse(false);
    }

    /**
     * A field holds a list of expressions when its type is {@code ExprList} or a define tagged {@code Slice}.
     */
    public boolean isListType(String type) {
        return LIST_TYPE.equals(type) || lookup(type).map(define -> define.hasTag(SLICE_TAG))
                                                     .orElse(false);
    }

    public int size() {
        return byName.size();
    }
}
