package com.agentfleet.dispatch.cli;

import com.agentfleet.core.model.SchedulingResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the AgentFleet CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTFLEET v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLEET]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void tick(int number, int decisions) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [TICK " + number + "]|@ " + decisions + " decision"
                        + (decisions != 1 ? "s" : "")));
    }

    public static void decision(SchedulingResult result) {
        if (result.assigned()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green) ->|@ " + result.taskId() + " on " + result.agentId() + " (" + result.reason() + ")"));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(magenta) ..|@ " + result.taskId() + " waiting (" + result.reason() + ")"));
        }
    }
}
