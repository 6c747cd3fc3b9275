package com.gatekeeper.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.UnmatchedArgumentException;

import java.io.PrintWriter;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 * Usage errors exit 1; exit code 2 is reserved for hard blocks.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    /** Exit code for unparseable arguments. */
    public static final int USAGE_EXIT_CODE = 1;

    private final GatekeeperCommand gatekeeperCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(GatekeeperCommand gatekeeperCommand, IFactory factory) {
        this.gatekeeperCommand = gatekeeperCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server keeps the JVM alive; picocli's
        // execute() would return immediately.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = commandLine(gatekeeperCommand, factory).execute(args);
    }

    /**
     * Command line with the usage-error handler installed. Subcommands are declared
     * on {@link GatekeeperCommand}, so they exist by now and inherit the handler.
     */
    static CommandLine commandLine(GatekeeperCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setParameterExceptionHandler(CliRunner::handleUsageError);
    }

    /** Prints the problem and usage, then exits 1; picocli's own code 2 reads as a block to the host. */
    static int handleUsageError(ParameterException ex, String[] args) {
        CommandLine cmd = ex.getCommandLine();
        PrintWriter err = cmd.getErr();
        err.println(ex.getMessage());
        UnmatchedArgumentException.printSuggestions(ex, err);
        cmd.usage(err, cmd.getColorScheme());
        return USAGE_EXIT_CODE;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
