package com.sandcastle;

import com.sandcastle.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class SandcastleApplication {

    public static void main(String[] args) {
        // Container entrypoints start the jar without arguments.
        if (args.length == 0 && System.getenv("SANDCASTLE_SERVE") != null) {
            args = new String[]{"serve"};
        }

        boolean serveMode = CliRunner.isServe(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(SandcastleApplication.class);

        if (serveMode) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // CLI-only: no web server
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}
