package org.pragmatica.optgen.compiler;

import org.junit.jupiter.api.Test;
import org.pragmatica.optgen.ast.Expr;
import org.pragmatica.optgen.error.Diagnostic;
import org.pragmatica.optgen.error.DiagnosticReporter;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RuleCompilerTest {

    private static final String COMPARISONS = """
        [Comparison] define Eq { Left Expr Right Expr }
        [Comparison] define Ne { Left Expr Right Expr }
        define Lt { Left Expr Right Expr }
        define Not { Input Expr }
        """;

    private static final OptCompiler COMPILER = OptCompiler.create(CompilerConfig.DEFAULT);

    private static Expr.Rule compileSingleRule(String rules) {
        var result = COMPILER.compile(COMPARISONS + rules, "test.opt");
        var success = assertInstanceOf(CompileResult.Success.class, result,
                                       () -> "compile failed: " + result);
        return success.root()
                      .rules()
                      .rules()
                      .get(0);
    }

    private static List<String> errors(String rules) {
        var result = COMPILER.compile(COMPARISONS + rules, "test.opt");
        var failure = assertInstanceOf(CompileResult.Failure.class, result);
        return failure.diagnostics()
                      .stream()
                      .map(Diagnostic::formatSimple)
                      .toList();
    }

    private static List<String> opNames(Expr.Match match) {
        return match.names()
                    .names()
                    .stream()
                    .map(Expr.OpName::name)
                    .toList();
    }

    @Test
    void matchName_resolvesToOperator() {
        var rule = compileSingleRule("[EliminateNot] (Not (Not $input:*)) => $input");

        var outer = assertInstanceOf(Expr.Match.class, rule.match());
        assertEquals(List.of("NotOp"), opNames(outer));
        var inner = assertInstanceOf(Expr.Match.class, outer.args().get(0));
        assertEquals(List.of("NotOp"), opNames(inner));
    }

    @Test
    void tagName_expandsToTaggedDefinesInDeclarationOrder() {
        var rule = compileSingleRule("[Flip] (Comparison | Lt $l:* $r:*) => (Eq $r $l)");

        var match = assertInstanceOf(Expr.Match.class, rule.match());
        assertEquals(List.of("EqOp", "NeOp", "LtOp"), opNames(match));

        var construct = assertInstanceOf(Expr.Construct.class, rule.replace());
        assertEquals("EqOp", construct.opName().name());
    }

    @Test
    void overlappingNames_resolveOnce() {
        var rule = compileSingleRule("[R] (Ne | Comparison $l:* $r:*) => $l");

        var match = assertInstanceOf(Expr.Match.class, rule.match());
        assertEquals(List.of("NeOp", "EqOp"), opNames(match));
    }

    @Test
    void unknownMatchName_isReportedAtMatch() {
        assertThat(errors("[R] (Foo $x:*) => $x"))
            .containsExactly("test.opt:5:5: 'Foo' is not an operator name or tag");
    }

    @Test
    void unknownConstructName_isReportedAtConstruct() {
        assertThat(errors("[R] (Not $x:*) => (Bar $x)"))
            .containsExactly("test.opt:5:19: 'Bar' is not an operator name");
    }

    @Test
    void tagInConstruct_isNotAnOperatorName() {
        assertThat(errors("[R] (Eq $l:* $r:*) => (Comparison $l $r)"))
            .containsExactly("test.opt:5:23: 'Comparison' is not an operator name");
    }

    @Test
    void tooManyMatchArguments_isReported() {
        assertThat(errors("[R] (Not * *) => (Not \"x\")"))
            .containsExactly("test.opt:5:5: too many arguments to 'Not' match: found 2, expected at most 1");
    }

    @Test
    void fewerMatchArguments_areAccepted() {
        var rule = compileSingleRule("[R] (Eq $l:*) => $l");

        assertInstanceOf(Expr.Match.class, rule.match());
    }

    @Test
    void wrongConstructArity_isReported() {
        assertThat(errors("[R] (Not $x:*) => (Not)"))
            .containsExactly("test.opt:5:19: wrong number of arguments to 'Not' construct: found 0, expected 1");
    }

    @Test
    void unboundReference_isReported() {
        assertThat(errors("[R] (Not $x:*) => $y"))
            .containsExactly("test.opt:5:19: unrecognized variable name 'y'");
    }

    @Test
    void referenceBeforeBind_isReported() {
        assertThat(errors("[R] (Eq $x $x:*) => $x"))
            .containsExactly("test.opt:5:9: unrecognized variable name 'x'");
    }

    @Test
    void referenceAfterBind_isAccepted() {
        var rule = compileSingleRule("[R] (Eq $x:* $x) => $x");

        var match = assertInstanceOf(Expr.Match.class, rule.match());
        assertInstanceOf(Expr.Ref.class, match.args().get(1));
    }

    @Test
    void duplicateBindLabel_isReported() {
        assertThat(errors("[R] (Eq $x:* $x:*) => $x"))
            .containsExactly("test.opt:5:14: duplicate bind label 'x'");
    }

    @Test
    void bindUnderNegation_isNotVisibleOutside() {
        assertThat(errors("[R] (Not ^$x:(Not)) => $x"))
            .containsExactly("test.opt:5:24: unrecognized variable name 'x'");
    }

    @Test
    void labels_areScopedToTheirRule() {
        assertThat(errors("""
            [First] (Not $x:*) => $x
            [Second] (Not *) => $x
            """)).containsExactly("test.opt:6:21: unrecognized variable name 'x'");
    }

    @Test
    void predicateArguments_mustBeBound() {
        assertThat(errors("[R] (Eq $l:* $r:*) & (IsConst $z) => $l"))
            .containsExactly("test.opt:5:31: unrecognized variable name 'z'");
    }

    @Test
    void predicateArguments_seeEarlierBinds() {
        var rule = compileSingleRule("[R] (Eq $l:* $r:* & (IsConst $r)) & ^(IsNull $l) => $l");

        var and = assertInstanceOf(Expr.MatchAnd.class, rule.match());
        var not = assertInstanceOf(Expr.MatchNot.class, and.right());
        var invoke = assertInstanceOf(Expr.MatchInvoke.class, not.input());
        assertEquals("IsNull", invoke.funcName());
    }

    @Test
    void duplicateRuleName_isReported() {
        var diagnostics = COMPILER.compile(COMPARISONS + """
                [R] (Not $x:*) => $x
                [R] (Not $x:*) => $x
                """, "test.opt");

        var failure = assertInstanceOf(CompileResult.Failure.class, diagnostics);
        assertEquals(1, failure.errorCount());
        var duplicate = failure.diagnostics()
                               .get(0);
        assertEquals("test.opt:6:1: duplicate 'R' rule statement", duplicate.formatSimple());
        assertThat(duplicate.notes()).containsExactly("'R' was first defined at test.opt:5:1");
    }

    @Test
    void rules_mayPrecedeTheirDefines() {
        var result = COMPILER.compile("""
            [EliminateNot] (Not (Not $input:*)) => $input
            define Not { Input Expr }
            """, "test.opt");

        assertTrue(result.isSuccess());
    }

    @Test
    void compilation_leavesParsedTreeUntouched() {
        var source = COMPARISONS + "[Flip] (Comparison $l:* $r:*) => (Eq $r $l)";
        var parsed = COMPILER.parse(source, "test.opt", new DiagnosticReporter());
        var before = parsed.toString();

        var compiled = RuleCompiler.compile(parsed.rules(),
                                            DefineValidator.validate(parsed.defines(),
                                                                     new DiagnosticReporter()),
                                            new DiagnosticReporter());

        assertEquals(before, parsed.toString());
        var parsedMatch = (Expr.Match) parsed.rules().rules().get(0).match();
        var compiledMatch = (Expr.Match) compiled.rules().get(0).match();
        assertEquals(List.of("Comparison"), opNames(parsedMatch));
        assertEquals(List.of("EqOp", "NeOp"), opNames(compiledMatch));
    }
}
