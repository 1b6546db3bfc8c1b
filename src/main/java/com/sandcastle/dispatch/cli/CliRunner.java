package com.sandcastle.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the one-shot operator commands ({@code health}, {@code env}) when the
 * jar is started without {@code serve}, and reports their exit code to Spring.
 * <p>
 * A serve invocation is left alone: the embedded web server hosts the session
 * API and keeps the JVM alive, while picocli would finish at once.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final String SERVE = "serve";

    private final SandcastleCommand sandcastleCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SandcastleCommand sandcastleCommand, IFactory factory) {
        this.sandcastleCommand = sandcastleCommand;
        this.factory = factory;
    }

    /**
     * True when {@code args} ask for the HTTP session service rather than a
     * one-shot command. Shared with the application entry point so both agree
     * on whether a web server is started.
     */
    public static boolean isServe(String... args) {
        return Arrays.asList(args).contains(SERVE);
    }

    @Override
    public void run(String... args) {
        if (isServe(args)) {
            log.debug("Serve mode, session API owns the process");
            return;
        }
        exitCode = new CommandLine(sandcastleCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        log.debug("Command {} finished with exit code {}", Arrays.toString(args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
