package com.stitchwork.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Stitchwork.
 * Routes to subcommands: checkpoints, inspect.
 */
@Command(
        name = "stitchwork",
        mixinStandardHelpOptions = true,
        version = "Stitchwork 0.1.0",
        description = "Dependency-ordered agent execution with copy-on-write workspaces",
        subcommands = {
                CheckpointsCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StitchworkCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
