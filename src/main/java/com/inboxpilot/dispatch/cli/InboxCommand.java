package com.inboxpilot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for InboxPilot.
 * Routes to subcommands: process, resume, status, serve.
 */
@Command(
        name = "inboxpilot",
        mixinStandardHelpOptions = true,
        version = "InboxPilot 0.1.0",
        description = "Email orchestration with human-in-the-loop approval, powered by LangGraph4j",
        subcommands = {
                ProcessCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class InboxCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
