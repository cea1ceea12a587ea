package org.pragmatica.optgen.printer;

import org.pragmatica.optgen.ast.Expr;
import org.pragmatica.optgen.ast.Shape;

/**
 * Renders expression trees as indented S-expressions.
 *
 * <p>Layout follows the node's {@link Shape}: REF nodes print as {@code (Type Field=value ...)},
 * SLICE nodes as {@code (Type child ...)} and VALUE nodes as literals ({@code "quoted"} strings
 * and tags, bare operator names and numbers). A node whose children are all plain values stays on
 * one line; any other node puts each child on its own line, one tab deeper. Source locations
 * print as a trailing {@code Src=<file:line:col>} field when enabled.
 *
 * <pre>
 * (Define
 *     Tags=(Tags)
 *     Name="Not"
 *     Fields=(DefineFields
 *         (DefineField Name="Input" Type="Expr" Src=&lt;test.opt:1:14&gt;)
 *     )
 *     Src=&lt;test.opt:1:1&gt;
 * )
 * </pre>
 */
public final class ExprPrinter {
    private static final String INDENT = "\t";
    private static final String SOURCE_FIELD = "Src";

    private final boolean includeSource;

    private ExprPrinter(boolean includeSource) {
        this.includeSource = includeSource;
    }

    public static ExprPrinter withSource() {
        return new ExprPrinter(true);
    }

    public static ExprPrinter withoutSource() {
        return new ExprPrinter(false);
    }

    public String print(Expr expr) {
        var sb = new StringBuilder();
        format(expr, 0, sb);
        sb.append('\n');
        return sb.toString();
    }

    private void format(Expr expr, int level, StringBuilder sb) {
        switch (expr.kind()
                    .shape()) {
            case VALUE -> formatValue(expr, sb);
            case SLICE -> formatSlice(expr, level, sb);
            case REF -> formatRef(expr, level, sb);
        }
    }

    private void formatValue(Expr expr, StringBuilder sb) {
        if (!(expr instanceof Expr.ValueExpr value)) {
            throw new IllegalStateException(expr.kind() + " is value-shaped but does not carry a value");
        }
        if (value.quoted()) {
            sb.append('"');
            escape(value.text(), sb);
            sb.append('"');
        } else {
            sb.append(value.text());
        }
    }

    private void formatSlice(Expr expr, int level, StringBuilder sb) {
        var children = expr.children();
        sb.append('(')
          .append(expr.kind()
                      .typeName());

        if (isSimple(expr)) {
            for (var child : children) {
                sb.append(' ');
                format(child, level, sb);
            }
            sb.append(')');
            return;
        }

        for (var child : children) {
            newLine(level + 1, sb);
            format(child, level + 1, sb);
        }
        newLine(level, sb);
        sb.append(')');
    }

    private void formatRef(Expr expr, int level, StringBuilder sb) {
        var fieldNames = expr.kind()
                             .fieldNames();
        var children = expr.children();
        if (fieldNames.size() != children.size()) {
            throw new IllegalStateException(expr.kind() + " has " + children.size() + " children but "
                                            + fieldNames.size() + " fields");
        }
        sb.append('(')
          .append(expr.kind()
                      .typeName());

        if (isSimple(expr)) {
            for (int i = 0; i < children.size(); i++) {
                sb.append(' ')
                  .append(fieldNames.get(i))
                  .append('=');
                format(children.get(i), level, sb);
            }
            if (includeSource) {
                expr.source()
                    .ifPresent(location -> sb.append(' ')
                                             .append(SOURCE_FIELD)
                                             .append("=<")
                                             .append(location)
                                             .append('>'));
            }
            sb.append(')');
            return;
        }

        for (int i = 0; i < children.size(); i++) {
            newLine(level + 1, sb);
            sb.append(fieldNames.get(i))
              .append('=');
            format(children.get(i), level + 1, sb);
        }
        if (includeSource && expr.source()
                                 .isPresent()) {
            newLine(level + 1, sb);
            sb.append(SOURCE_FIELD)
              .append("=<")
              .append(expr.source()
                          .get())
              .append('>');
        }
        newLine(level, sb);
        sb.append(')');
    }

    /**
     * Values, slices of values, and REF nodes built only from those fit on one line.
     */
    private boolean isSimple(Expr expr) {
        return switch (expr.kind()
                           .shape()) {
            case VALUE -> true;
            case SLICE -> expr.children()
                              .stream()
                              .allMatch(child -> child.kind()
                                                      .shape() == Shape.VALUE);
            case REF -> expr.children()
                            .stream()
                            .allMatch(this::isSimple);
        };
    }

    private static void newLine(int level, StringBuilder sb) {
        sb.append('\n')
          .append(INDENT.repeat(level));
    }

    private static void escape(String text, StringBuilder sb) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
    }
}
