package com.routeflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for RouteFlow.
 */
@Command(
        name = "routeflow",
        mixinStandardHelpOptions = true,
        version = "RouteFlow 0.1.0",
        description = "Staged analysis of advertising-campaign questions",
        subcommands = {
                AskCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RouteflowCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
