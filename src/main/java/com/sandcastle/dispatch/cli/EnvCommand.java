package com.sandcastle.dispatch.cli;

import com.sandcastle.core.security.EnvironmentSanitizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * CLI command: sandcastle env
 * <p>
 * Shows which variables of the current environment runtimes would not see.
 * Only names are printed, never values.
 */
@Command(name = "env", mixinStandardHelpOptions = true,
        description = "List environment variables withheld from runtimes")
@Component
public class EnvCommand implements Runnable {

    private final EnvironmentSanitizer sanitizer;
    private final Supplier<Map<String, String>> environment;

    @Option(names = "--show-passed", description = "Also list the names that are passed through")
    boolean showPassed;

    @Autowired
    public EnvCommand(EnvironmentSanitizer sanitizer) {
        this(sanitizer, System::getenv);
    }

    EnvCommand(EnvironmentSanitizer sanitizer, Supplier<Map<String, String>> environment) {
        this.sanitizer = sanitizer;
        this.environment = environment;
    }

    @Override
    public void run() {
        Map<String, String> env = environment.get();
        Set<String> withheld = sanitizer.withheld(env);

        ConsoleOutput.printBanner();
        if (withheld.isEmpty()) {
            ConsoleOutput.success("No sensitive variables present in this environment");
        } else {
            ConsoleOutput.info(withheld.size() + " variable(s) withheld from runtimes:");
            withheld.forEach(ConsoleOutput::withheld);
        }
        if (showPassed) {
            ConsoleOutput.rule();
            ConsoleOutput.info("Passed through:");
            sanitizer.sanitize(env).keySet().forEach(ConsoleOutput::passed);
        }
    }
}
