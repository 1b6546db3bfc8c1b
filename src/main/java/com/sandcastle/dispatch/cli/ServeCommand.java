package com.sandcastle.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: sandcastle serve
 * <p>
 * Starts the HTTP API. The web server is enabled by
 * {@link com.sandcastle.SandcastleApplication#main} detecting "serve" in args;
 * {@link CliRunner} then skips picocli and the banner is printed once the
 * server is listening.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 sandcastle serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Sandcastle HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Sandcastle server running on port " + port);
        System.out.println();
        System.out.println("  Sessions:  http://localhost:" + port + "/api/v1/sessions");
        System.out.println("  Health:    http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
