package org.pragmatica.optgen.ast;

import java.util.List;

/**
 * Closed set of node types: printed name, shape and, for {@link Shape#REF} kinds, field names
 * in child order.
 */
public enum ExprKind {
    ROOT("Root", Shape.REF, "Defines", "Rules"),
    DEFINE_SET("DefineSet", Shape.SLICE),
    DEFINE("Define", Shape.REF, "Tags", "Name", "Fields"),
    DEFINE_FIELDS("DefineFields", Shape.SLICE),
    DEFINE_FIELD("DefineField", Shape.REF, "Name", "Type"),
    TAGS("Tags", Shape.SLICE),
    TAG("Tag", Shape.VALUE),
    RULE_SET("RuleSet", Shape.SLICE),
    RULE("Rule", Shape.REF, "Name", "Tags", "Match", "Replace"),
    MATCH("Match", Shape.REF, "Names", "Args"),
    MATCH_AND("MatchAnd", Shape.REF, "Left", "Right"),
    MATCH_NOT("MatchNot", Shape.REF, "Input"),
    MATCH_ANY("MatchAny", Shape.REF),
    MATCH_LIST("MatchList", Shape.REF, "MatchItem"),
    MATCH_INVOKE("MatchInvoke", Shape.REF, "FuncName", "Args"),
    BIND("Bind", Shape.REF, "Label", "Target"),
    REF("Ref", Shape.REF, "Label"),
    CONSTRUCT("Construct", Shape.REF, "OpName", "Args"),
    CONSTRUCT_LIST("ConstructList", Shape.REF, "Items"),
    OP_NAMES("OpNames", Shape.SLICE),
    OP_NAME("OpName", Shape.VALUE),
    LIST("List", Shape.SLICE),
    STRING("String", Shape.VALUE),
    NUMBER("Number", Shape.VALUE);

    private final String typeName;
    private final Shape shape;
    private final List<String> fieldNames;

    ExprKind(String typeName, Shape shape, String... fieldNames) {
        this.typeName = typeName;
        this.shape = shape;
        this.fieldNames = List.of(fieldNames);
    }

    public String typeName() {
        return typeName;
    }

    public Shape shape() {
        return shape;
    }

    public List<String> fieldNames() {
        return fieldNames;
    }
}
