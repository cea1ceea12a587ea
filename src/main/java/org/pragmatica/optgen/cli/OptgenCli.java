package org.pragmatica.optgen.cli;

import picocli.CommandLine;

/**
 * Main entry point of the {@code optgen} command line tool.
 */
@CommandLine.Command(name = "optgen",
        mixinStandardHelpOptions = true,
        version = "optgen 0.1.0",
        description = "Compiles optimizer rule definition files",
        subcommands = {
                CompileCommand.class,
                CommandLine.HelpCommand.class})
public final class OptgenCli implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        return new CommandLine(new OptgenCli());
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
