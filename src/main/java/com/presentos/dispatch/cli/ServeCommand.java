package com.presentos.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: presentos serve
 * <p>
 * Starts the router as a long-running HTTP server. The web server is enabled by
 * {@link com.presentos.PresentOsApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so the embedded server keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 presentos serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP router")
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
        ConsoleOutput.info("Router listening on port " + port);
        System.out.println();
        System.out.println("  Route:   POST http://localhost:" + port + "/route");
        System.out.println("  Health:  GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
