package org.pragmatica.optgen.cli;

import org.pragmatica.optgen.Optgen;
import org.pragmatica.optgen.compiler.CompileResult;
import org.pragmatica.optgen.printer.ExprPrinter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Compiles one file and prints the compiled tree, or the diagnostics when compilation fails.
 */
@CommandLine.Command(name = "compile", description = "Compiles a rule definition file and prints the compiled tree")
public final class CompileCommand implements Callable<Integer> {
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CompileCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "<filename>", description = "rule definition file")
    private Path file;

    @CommandLine.Option(names = "--max-errors", defaultValue = "2",
            description = "number of diagnostics shown before the summary line (default: ${DEFAULT-VALUE})")
    private int maxErrors;

    @CommandLine.Option(names = "--no-positions", description = "omit source locations from the output")
    private boolean noPositions;

    @CommandLine.Option(names = "--context", description = "show the source line of each diagnostic")
    private boolean context;

    @Override
    public Integer call() {
        var out = spec.commandLine()
                      .getOut();
        var err = spec.commandLine()
                      .getErr();
        if (maxErrors < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--max-errors must not be negative");
        }

        String source;
        try{
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.debug("Failed to read {}", file, e);
            err.println("optgen: cannot read " + file + ": " + e.getMessage());
            err.flush();
            return EXIT_IO_ERROR;
        }

        var compiler = Optgen.builder()
                             .errorLimit(maxErrors)
                             .build();
        var result = compiler.compile(source, file.toString());

        if (result instanceof CompileResult.Success success) {
            var printer = noPositions
                          ? ExprPrinter.withoutSource()
                          : ExprPrinter.withSource();
            out.print(printer.print(success.root()));
            out.flush();
            return CommandLine.ExitCode.OK;
        }

        var failure = (CompileResult.Failure) result;
        int limit = compiler.config()
                            .errorLimit();
        if (context) {
            err.print(failure.formatDiagnostics(limit));
        } else {
            failure.summary(limit)
                   .forEach(err::println);
        }
        err.flush();
        return EXIT_COMPILE_ERROR;
    }
}
