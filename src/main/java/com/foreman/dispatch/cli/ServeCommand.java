package com.foreman.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: foreman serve
 * <p>
 * Starts the HTTP server with the REST API and the SSE event stream. The web server is
 * enabled by {@link com.foreman.ForemanApplication#main} when "serve" is in the arguments;
 * {@link CliRunner} then skips picocli, so {@link #run()} only backs {@code --help}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Foreman HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Foreman server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/auto-mode");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/auto-mode/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
