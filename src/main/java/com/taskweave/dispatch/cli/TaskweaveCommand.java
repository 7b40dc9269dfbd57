package com.taskweave.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Taskweave.
 * Routes to subcommands: analyze, plan.
 */
@Command(
        name = "taskweave",
        mixinStandardHelpOptions = true,
        version = "Taskweave 0.1.0",
        description = "Breaks tasks into dependency-ordered subtasks and plans their execution",
        subcommands = {
                AnalyzeCommand.class,
                PlanCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskweaveCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
