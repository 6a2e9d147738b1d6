package com.sitedigest.dispatch.cli;

import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * {@code sitedigest serve}: long-running HTTP server for the job API.
 * <p>
 * The servlet stack is switched on in {@link com.sitedigest.SitedigestApplication#main}
 * and {@link CliRunner} never dispatches this command, so {@link #run()} only
 * matters for help output. The endpoint listing is printed once the main web
 * server has bound its port ({@code SERVER_PORT} or {@code server.port}).
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Sitedigest HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.info("Start with: sitedigest serve");
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        // A separate management port fires its own event under the "management" namespace.
        if (event.getApplicationContext().getServerNamespace() != null) {
            return;
        }
        printEndpoints(event.getWebServer().getPort());
    }

    static void printEndpoints(int port) {
        String base = "http://localhost:" + port;
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Sitedigest server running on port " + port);
        System.out.println();
        System.out.println("  Submit:     POST " + base + "/api/v1/scrape");
        System.out.println("  Inline:     POST " + base + "/api/v1/scrape/sync");
        System.out.println("  Jobs:       GET  " + base + "/api/v1/jobs");
        System.out.println("  Health:     GET  " + base + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
