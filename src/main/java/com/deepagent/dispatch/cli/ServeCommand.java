package com.deepagent.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: deepagent serve
 * <p>
 * Starts the HTTP server. The web server is switched on by
 * {@link com.deepagent.DeepAgentApplication#main} when "serve" is among the arguments, and
 * {@link CliRunner} then skips picocli, so {@link #run()} only prints the banner for
 * {@code --help} style invocations. The startup banner comes from the
 * {@link WebServerInitializedEvent} listener once Tomcat is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Deep Agent HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8000}")
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
        ConsoleOutput.info("Deep Agent server running on port " + port);
        System.out.println();
        System.out.println("  Sessions:  http://localhost:" + port + "/api/sessions");
        System.out.println("  Health:    http://localhost:" + port + "/api/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
