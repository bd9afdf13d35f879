package com.agentfleet.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for AgentFleet.
 */
@Command(
        name = "agentfleet",
        mixinStandardHelpOptions = true,
        version = "AgentFleet 0.1.0",
        description = "Orchestration core for a supervised pool of agent worker processes",
        subcommands = {
                ScheduleCommand.class,
                PoliciesCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentFleetCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
