package com.kaspaaio.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: kaspa-aio serve
 * <p>
 * Starts the installer as a long-running HTTP server exposing the REST API and the
 * SSE progress stream. The web server is enabled by
 * {@link com.kaspaaio.KaspaAioApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so the embedded server keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 kaspa-aio serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the installer HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Installer API running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Events:     http://localhost:" + port + "/api/v1/reconfigurations/events");
        System.out.println("  Health:     http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
