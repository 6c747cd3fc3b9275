package com.gatekeeper.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Gatekeeper.
 * Routes to subcommands: hook, serve, health, log.
 */
@Command(
        name = "gatekeeper",
        mixinStandardHelpOptions = true,
        version = "Gatekeeper 0.1.0",
        description = "Validation and enforcement hooks for coding-agent tool calls",
        subcommands = {
                HookCommand.class,
                ServeCommand.class,
                HealthCommand.class,
                LogCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GatekeeperCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
