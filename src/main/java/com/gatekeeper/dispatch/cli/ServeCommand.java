package com.gatekeeper.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: gatekeeper serve
 * <p>
 * Runs the gates behind an HTTP endpoint so a long-lived process can serve many
 * hook invocations and keep its validation cache warm. The web server is enabled
 * by {@link com.gatekeeper.GatekeeperApplication#main} detecting "serve" in args.
 * <p>
 * In serve mode, {@link CliRunner} skips picocli; the banner is printed once the
 * embedded server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 gatekeeper serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Gatekeeper HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not reached in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Gatekeeper server running on port " + port);
        System.out.println();
        System.out.println("  Hooks:   POST http://localhost:" + port + "/api/v1/hooks");
        System.out.println("  Health:  GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
