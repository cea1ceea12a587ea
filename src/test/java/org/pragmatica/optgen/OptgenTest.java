package org.pragmatica.optgen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pragmatica.optgen.compiler.CompileResult;
import org.pragmatica.optgen.compiler.CompilerConfig;
import org.pragmatica.optgen.error.RecoveryStrategy;
import org.pragmatica.optgen.printer.ExprPrinter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class OptgenTest {

    private static final String SCALAR_RULES = """
        # Scalar operators.
        [Scalar, Comparison]
        define Eq {
            Left  Expr
            Right Expr
        }

        [Scalar, Comparison]
        define Ne {
            Left  Expr
            Right Expr
        }

        [Scalar]
        define Not {
            Input Expr
        }

        [Scalar]
        define Const {
            Value string
        }

        [Relational]
        define Select {
            Input   Expr
            Filters ExprList
            Def     SelectPrivate
        }

        [Private]
        define SelectPrivate {
            Hint int
        }

        [EliminateNot, Normalize]
        (Not (Not $input:*)) => $input

        [NegateComparison, Normalize]
        (Not $cmp:(Comparison $left:* $right:*) & ^(HasNullOperand $left $right))
        =>
        (Not $cmp)

        [FoldConstFilter, Normalize]
        (Select $input:* [ ... $item:(Const "true") ... ] $def:*)
        =>
        (Select $input [ ] $def)
        """;

    @Test
    void compile_ruleSet_succeeds() {
        var result = Optgen.compile(SCALAR_RULES, "scalar.opt");

        var success = assertInstanceOf(CompileResult.Success.class, result,
                                       () -> "unexpected diagnostics: " + result);
        var root = success.root();
        assertEquals(6, root.defines().defines().size());
        assertEquals(3, root.rules().rules().size());

        var printed = Optgen.print(root);
        assertThat(printed)
            .contains("Names=(OpNames EqOp NeOp)")
            .contains("FuncName=\"HasNullOperand\"")
            .contains("(MatchList")
            .contains("OpName=SelectOp")
            .contains("Src=<scalar.opt:");
    }

    @Test
    void compile_duplicateDefine_reportsExactlyOneError() {
        var result = Optgen.compile("define Lt {}\ndefine Lt {}", "test.opt");

        var failure = assertInstanceOf(CompileResult.Failure.class, result);
        assertThat(failure.summary(2)).containsExactly("test.opt:2:1: duplicate 'Lt' define statement");
        assertTrue(result.isFailure());
    }

    @Test
    void compile_mixedErrors_areCollectedAcrossPhases() {
        var result = Optgen.compile("""
            define A { Input }
            define B { Input Foo }
            [R] (C $x:*) => $y
            """, "test.opt");

        var failure = assertInstanceOf(CompileResult.Failure.class, result);
        assertThat(failure.summary(10)).containsExactly(
            "test.opt:1:18: expected field type, found '}'",
            "test.opt:2:12: unknown type 'Foo' for field 'Input' in 'B'",
            "test.opt:3:5: 'C' is not an operator name or tag",
            "test.opt:3:17: unrecognized variable name 'y'");
        assertThat(failure.summary(2)).containsExactly(
            "test.opt:1:18: expected field type, found '}'",
            "test.opt:2:12: unknown type 'Foo' for field 'Input' in 'B'",
            "... too many errors (2 more)");
    }

    @Test
    void compile_failure_formatsDiagnosticsWithContext() {
        var result = Optgen.compile("define Lt {}\ndefine Lt {}", "test.opt");

        var failure = assertInstanceOf(CompileResult.Failure.class, result);
        assertThat(failure.formatDiagnostics(2))
            .contains("error: duplicate 'Lt' define statement")
            .contains("--> test.opt:2:1")
            .contains("= note: 'Lt' was first defined at test.opt:1:1");
    }

    @Test
    void compile_layoutAndCommentsDoNotChangeOutput() {
        var compact = """
            [Scalar, Comparison] define Eq { Left Expr Right Expr }
            [Scalar, Comparison] define Ne { Left Expr Right Expr }
            [Scalar] define Not { Input Expr }
            [Scalar] define Const { Value string }
            [Relational] define Select { Input Expr Filters ExprList Def SelectPrivate }
            [Private] define SelectPrivate { Hint int }
            [EliminateNot, Normalize] (Not (Not $input:*)) => $input
            [NegateComparison, Normalize] (Not $cmp:(Comparison $left:* $right:*) & ^(HasNullOperand $left $right)) => (Not $cmp)
            [FoldConstFilter, Normalize] (Select $input:* [ ... $item:(Const "true") ... ] $def:*) => (Select $input [] $def)
            """;

        var first = assertInstanceOf(CompileResult.Success.class, Optgen.compile(SCALAR_RULES, "a.opt"));
        var second = assertInstanceOf(CompileResult.Success.class, Optgen.compile(compact, "b.opt"));

        var printer = ExprPrinter.withoutSource();
        assertEquals(printer.print(first.root()), printer.print(second.root()));
    }

    @Test
    void compile_file_usesPathInLocations(@TempDir Path dir) throws IOException {
        var file = dir.resolve("dup.opt");
        Files.writeString(file, "define Lt {}\ndefine Lt {}", StandardCharsets.UTF_8);

        var failure = assertInstanceOf(CompileResult.Failure.class, Optgen.compile(file));

        assertThat(failure.summary(2)).containsExactly(file + ":2:1: duplicate 'Lt' define statement");
    }

    @Test
    void compile_missingFile_throws(@TempDir Path dir) {
        assertThrows(IOException.class, () -> Optgen.compile(dir.resolve("missing.opt")));
    }

    @Test
    void builder_configuresCompiler() {
        var compiler = Optgen.builder()
                             .errorLimit(5)
                             .recovery(RecoveryStrategy.NONE)
                             .build();

        assertEquals(new CompilerConfig(5, RecoveryStrategy.NONE), compiler.config());
    }

    @Test
    void config_rejectsNegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> new CompilerConfig(-1, RecoveryStrategy.STATEMENT));
    }
}
