package com.sandcastle.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root of the {@code sandcastle} command line. {@code serve} hosts the session
 * API; {@code health} and {@code env} are operator checks that exit at once.
 */
@Command(
        name = "sandcastle",
        mixinStandardHelpOptions = true,
        version = SandcastleCommand.VERSION,
        description = {
                "Runs untrusted Python in isolated, stateful sessions behind an HTTP API.",
                "Each session owns one interpreter process and a private scratch directory."
        },
        commandListHeading = "%nCommands:%n",
        footer = {"", "Start the service with: sandcastle serve"},
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                EnvCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SandcastleCommand implements Runnable {

    static final String VERSION = "Sandcastle 0.1.0";

    @Spec
    CommandSpec spec;

    /**
     * With no subcommand there is nothing to run; show what can be.
     */
    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
