package com.agentfleet.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentfleet serve
 * <p>
 * Starts the REST API. {@link CliRunner} skips picocli in this mode, so {@link #run()} only
 * serves {@code --help}; the banner is printed once the web server is up.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the AgentFleet HTTP server")
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
        ConsoleOutput.info("AgentFleet server running on port " + port);
        System.out.println("  Asks:     http://localhost:" + port + "/api/v1/asks");
        System.out.println("  Runtime:  http://localhost:" + port + "/api/v1/runtime/queues");
        System.out.println("  Events:   http://localhost:" + port + "/api/v1/events");
        System.out.println("  Health:   http://localhost:" + port + "/api/v1/health");
    }
}
