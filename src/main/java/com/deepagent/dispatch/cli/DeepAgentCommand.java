package com.deepagent.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: serve, health, sandbox-check.
 */
@Command(
        name = "deepagent",
        mixinStandardHelpOptions = true,
        version = "Deep Agent 0.1.0",
        description = "Agent action execution service with sandboxed tools and human review",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                SandboxCheckCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DeepAgentCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
