package org.pragmatica.optgen.compiler;

import org.pragmatica.optgen.ast.Expr;
import org.pragmatica.optgen.error.DiagnosticReporter;
import org.pragmatica.optgen.lang.OptParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the compile pipeline over one source file: parse, validate defines, compile rules.
 *
 * <p>Each phase checks everything it can before the next one runs, and all phases report to the
 * same {@link DiagnosticReporter}, which lives only as long as one {@link #compile} call. The
 * compiler itself holds nothing but its configuration and may be shared.
 */
public final class OptCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(OptCompiler.class);

    private final CompilerConfig config;

    private OptCompiler(CompilerConfig config) {
        this.config = config;
    }

    public static OptCompiler create(CompilerConfig config) {
        return new OptCompiler(config);
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Parse without validation or name resolution.
     */
    public Expr.Root parse(String source, String filename, DiagnosticReporter reporter) {
        return OptParser.parse(source, filename, config.recoveryStrategy(), reporter);
    }

    public CompileResult compile(String source, String filename) {
        var reporter = new DiagnosticReporter();

        var parsed = parse(source, filename, reporter);
        LOGGER.debug("Parsed {}: {} define(s), {} rule(s), {} syntax error(s)",
                     filename,
                     parsed.defines()
                           .defines()
                           .size(),
                     parsed.rules()
                           .rules()
                           .size(),
                     reporter.count());

        var defines = DefineValidator.validate(parsed.defines(), reporter);
        var rules = RuleCompiler.compile(parsed.rules(), defines, reporter);

        if (reporter.hasErrors()) {
            LOGGER.debug("Compilation of {} failed with {} error(s)", filename, reporter.count());
            return new CompileResult.Failure(reporter.diagnostics(), source);
        }

        LOGGER.debug("Compiled {}: {} define(s), {} rule(s)", filename, defines.size(), rules.rules()
                                                                                              .size());
        return new CompileResult.Success(new Expr.Root(parsed.defines(), rules), source);
    }
}
