package com.workgraph.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: workgraph serve
 * <p>
 * Starts Workgraph as a long-running HTTP server exposing the analytics REST API.
 * The web server is enabled by {@link com.workgraph.WorkgraphApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli and the banner is
 * printed once the web server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 workgraph serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Workgraph HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached when picocli runs outside serve mode, e.g. with --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Workgraph server running on port " + port);
        System.out.println();
        System.out.println("  Analytics:  http://localhost:" + port + "/api/v1/analytics");
        System.out.println("  Index:      http://localhost:" + port + "/api/v1/index");
        System.out.println("  Health:     http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
