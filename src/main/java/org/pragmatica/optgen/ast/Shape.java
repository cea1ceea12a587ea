package org.pragmatica.optgen.ast;

/**
 * Structural category of a node type.
 */
public enum Shape {
    /**
     * Identity node with named fields, printed as {@code (Type Field=value ...)}.
     */
    REF,

    /**
     * Wrapped primitive, compared and printed by value.
     */
    VALUE,

    /**
     * Ordered homogeneous sequence, printed as {@code (Type child child ...)}.
     */
    SLICE
}
