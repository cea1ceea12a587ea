package org.pragmatica.optgen.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class OptgenCliTest {

    private static final String ELIMINATE_NOT = """
        define Not { Input Expr }

        [EliminateNot, Normalize]
        (Not (Not $input:*)) => $input
        """;

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = OptgenCli.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    private Path write(String name, String content) throws IOException {
        var file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void compile_validFile_printsTree() throws IOException {
        var file = write("not.opt", ELIMINATE_NOT);

        int exitCode = commandLine.execute("compile", file.toString());

        assertEquals(CommandLine.ExitCode.OK, exitCode);
        assertThat(out.toString())
            .startsWith("(Root\n")
            .contains("Names=(OpNames NotOp)")
            .contains("Src=<" + file + ":1:1>");
        assertEquals("", err.toString());
    }

    @Test
    void compile_noPositions_omitsSourceFields() throws IOException {
        var file = write("not.opt", ELIMINATE_NOT);

        int exitCode = commandLine.execute("compile", "--no-positions", file.toString());

        assertEquals(CommandLine.ExitCode.OK, exitCode);
        assertThat(out.toString()).contains("Replace=(Ref Label=\"input\")").doesNotContain("Src=");
    }

    @Test
    void compile_invalidFile_printsDiagnosticsAndFails() throws IOException {
        var file = write("dup.opt", "define Lt {}\ndefine Lt {}\n");

        int exitCode = commandLine.execute("compile", file.toString());

        assertEquals(CompileCommand.EXIT_COMPILE_ERROR, exitCode);
        assertEquals(file + ":2:1: duplicate 'Lt' define statement" + System.lineSeparator(), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void compile_manyErrors_areCapped() throws IOException {
        var file = write("bad.opt", """
            define A { X }
            define B { X }
            define C { X }
            """);

        int exitCode = commandLine.execute("compile", file.toString());

        assertEquals(CompileCommand.EXIT_COMPILE_ERROR, exitCode);
        assertThat(err.toString().lines()).hasSize(3)
                                          .last()
                                          .isEqualTo("... too many errors (1 more)");
    }

    @Test
    void compile_maxErrors_raisesTheCap() throws IOException {
        var file = write("bad.opt", """
            define A { X }
            define B { X }
            define C { X }
            """);

        int exitCode = commandLine.execute("compile", "--max-errors", "5", file.toString());

        assertEquals(CompileCommand.EXIT_COMPILE_ERROR, exitCode);
        assertThat(err.toString().lines()).hasSize(3)
                                          .allMatch(line -> line.endsWith("expected field type, found '}'"));
    }

    @Test
    void compile_context_showsSourceLines() throws IOException {
        var file = write("dup.opt", "define Lt {}\ndefine Lt {}\n");

        int exitCode = commandLine.execute("compile", "--context", file.toString());

        assertEquals(CompileCommand.EXIT_COMPILE_ERROR, exitCode);
        assertThat(err.toString())
            .contains("error: duplicate 'Lt' define statement")
            .contains("2 | define Lt {}")
            .contains("^^^^^^");
    }

    @Test
    void compile_missingFile_reportsIoError() {
        var missing = dir.resolve("missing.opt");

        int exitCode = commandLine.execute("compile", missing.toString());

        assertEquals(CompileCommand.EXIT_IO_ERROR, exitCode);
        assertThat(err.toString()).startsWith("optgen: cannot read " + missing);
    }

    @Test
    void compile_negativeMaxErrors_isUsageError() throws IOException {
        var file = write("not.opt", ELIMINATE_NOT);

        int exitCode = commandLine.execute("compile", "--max-errors", "-1", file.toString());

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertThat(err.toString()).contains("--max-errors must not be negative");
    }

    @Test
    void noSubcommand_isUsageError() {
        int exitCode = commandLine.execute();

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertThat(err.toString()).contains("Missing required subcommand");
    }

    @Test
    void version_printsToolVersion() {
        int exitCode = commandLine.execute("--version");

        assertEquals(CommandLine.ExitCode.OK, exitCode);
        assertThat(out.toString()).contains("optgen 0.1.0");
    }
}
