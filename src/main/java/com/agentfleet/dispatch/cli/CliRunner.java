package com.agentfleet.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Spring context and reports its exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AgentFleetCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AgentFleetCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // The embedded web server owns the JVM in serve mode.
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    static boolean isServeMode(String... args) {
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
