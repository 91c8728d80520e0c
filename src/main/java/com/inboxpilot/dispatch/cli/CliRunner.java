package com.inboxpilot.dispatch.cli;

import com.inboxpilot.InboxPilotApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs a one-shot {@link InboxCommand} once the context is up and hands its exit code back to
 * Spring Boot. In serve mode the web server owns the process and nothing is parsed here.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final InboxCommand inboxCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(InboxCommand inboxCommand, IFactory factory) {
        this.inboxCommand = inboxCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (InboxPilotApplication.isServeMode(args)) {
            log.info("Serving the conversation API; one-shot commands are disabled");
            return;
        }
        exitCode = new CommandLine(inboxCommand, factory).execute(args);
        if (exitCode != 0) {
            log.debug("Command {} exited with {}", String.join(" ", args), exitCode);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
