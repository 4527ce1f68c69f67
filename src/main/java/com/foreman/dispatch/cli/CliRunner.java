package com.foreman.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ForemanCommand foremanCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ForemanCommand foremanCommand, IFactory factory) {
        this.foremanCommand = foremanCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // The embedded web server owns the JVM in serve mode; picocli would return immediately
        if (ForemanCommand.isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(foremanCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
