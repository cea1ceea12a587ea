package org.pragmatica.optgen.tree;

/**
 * A position in a source file (line and column, both 1-based; offset 0-based).
 */
public record SourceLocation(String file, int line, int column, int offset) {

    public static SourceLocation at(String file, int line, int column, int offset) {
        return new SourceLocation(file, line, column, offset);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
