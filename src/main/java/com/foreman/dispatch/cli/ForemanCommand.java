package com.foreman.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.Arrays;

/**
 * Top-level CLI command. Routes to subcommands: auto, features, health, serve.
 */
@Command(
        name = "foreman",
        mixinStandardHelpOptions = true,
        version = "Foreman 0.1.0",
        description = "Runs coding agents over a project's feature backlog",
        subcommands = {
                AutoCommand.class,
                FeaturesCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ForemanCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }

    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains("serve");
    }
}
