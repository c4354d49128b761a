package com.codeshift.converter.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: codeshift serve
 * <p>
 * The web server itself is enabled by
 * {@link com.codeshift.converter.ConverterApplication#main} when it sees
 * "serve"; picocli is skipped in that mode, so {@link #run()} only prints
 * the banner when reached through help or tests.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP server exposing POST /runs and GET /runs/{id}")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port = 8080;

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
        ConsoleOutput.info("codeshift server running on port " + port);
        System.out.println("  Runs API:   http://localhost:" + port + "/runs");
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
