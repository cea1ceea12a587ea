package org.pragmatica.optgen.compiler;

import org.pragmatica.optgen.ast.Expr;
import org.pragmatica.optgen.error.Diagnostic;
import org.pragmatica.optgen.error.DiagnosticReporter;

import java.util.HashSet;

/**
 * Checks define statements and builds the {@link DefineTable} used by rule compilation.
 *
 * <p>All defines are entered into the table before any of them is checked, so field types may
 * refer to defines declared later in the file. Every define is checked and every violation is
 * reported; each diagnostic points at the offending field where there is one.
 */
public final class DefineValidator {
    private final DiagnosticReporter reporter;
    private final DefineTable table;

    private DefineValidator(DiagnosticReporter reporter) {
        this.reporter = reporter;
        this.table = new DefineTable();
    }

    public static DefineTable validate(Expr.DefineSet defines, DiagnosticReporter reporter) {
        var validator = new DefineValidator(reporter);
        validator.collect(defines);
        for (var define : defines.defines()) {
            validator.check(define);
        }
        return validator.table;
    }

    private void collect(Expr.DefineSet defines) {
        for (var define : defines.defines()) {
            table.add(define)
                 .ifPresent(first -> reporter.report(
                     Diagnostic.error(Diagnostic.Category.SEMANTIC,
                                      "duplicate '" + define.name() + "' define statement",
                                      define.src())
                               .withNote("'" + define.name() + "' was first defined at " + first.src())));
        }
    }

    private void check(Expr.Define define) {
        checkFieldNames(define);
        checkFieldTypes(define);
        checkPrivateField(define);
        checkListField(define);
        checkShape(define);
    }

    private void checkFieldNames(Expr.Define define) {
        var seen = new HashSet<String>();
        for (var field : define.fields()
                               .fields()) {
            if (!seen.add(field.name())) {
                error("duplicate field '" + field.name() + "' in '" + define.name() + "'", field);
            }
        }
    }

    private void checkFieldTypes(Expr.Define define) {
        for (var field : define.fields()
                               .fields()) {
            if (!table.isKnownType(field.type())) {
                error("unknown type '" + field.type() + "' for field '" + field.name() + "' in '" + define.name() + "'",
                      field);
            }
        }
    }

    private void checkPrivateField(Expr.Define define) {
        var fields = define.fields()
                           .fields();
        for (int i = 0; i < fields.size() - 1; i++) {
            var field = fields.get(i);
            if (table.isPrivateType(field.type())) {
                error("private field '" + field.name() + "' is not the last field in '" + define.name() + "'", field);
                return;
            }
        }
    }

    private void checkListField(Expr.Define define) {
        var fields = define.fields()
                           .fields();
        int last = fields.size() - 1;
        int lastNonPrivate = last >= 0 && table.isPrivateType(fields.get(last)
                                                                    .type())
                             ? last - 1
                             : last;

        for (int i = 0; i < fields.size(); i++) {
            var field = fields.get(i);
            if (table.isPrivateType(field.type()) || !table.isListType(field.type())) {
                continue;
            }
            if (i != lastNonPrivate) {
                error("list field '" + field.name() + "' is not the last non-private field in '" + define.name() + "'",
                      field);
                return;
            }
        }
    }

    private void checkShape(Expr.Define define) {
        boolean value = define.hasTag(DefineTable.VALUE_TAG);
        boolean slice = define.hasTag(DefineTable.SLICE_TAG);
        int fieldCount = define.fields()
                               .size();

        if (value && slice) {
            error("define '" + define.name() + "' cannot be both Value and Slice", define);
        } else if (value && fieldCount != 1) {
            error("value define '" + define.name() + "' must have exactly one field", define);
        } else if (value) {
            var field = define.fields()
                              .fields()
                              .get(0);
            if (!DefineTable.PRIMITIVE_TYPES.contains(field.type())) {
                error("value define '" + define.name() + "' must wrap a primitive type, found '" + field.type() + "'",
                      field);
            }
        } else if (slice && fieldCount != 1) {
            error("slice define '" + define.name() + "' must have exactly one field", define);
        }
    }

    private void error(String message, Expr.DefineField field) {
        reporter.error(Diagnostic.Category.SEMANTIC, message, field.src());
    }

    private void error(String message, Expr.Define define) {
        reporter.error(Diagnostic.Category.SEMANTIC, message, define.src());
    }
}
