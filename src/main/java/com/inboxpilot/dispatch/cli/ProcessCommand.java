package com.inboxpilot.dispatch.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.inboxpilot.core.engine.ConversationEngine;
import com.inboxpilot.core.engine.DuplicateConversationException;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.persistence.ConversationSnapshot;
import com.inboxpilot.dispatch.api.EmailRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * CLI command: inboxpilot process &lt;email.json&gt;
 * <p>
 * Runs an email (same JSON shape as the REST API) until it needs a human decision or finishes.
 * Resuming from another process requires {@code inbox.persistence.mode=jdbc}.
 */
@Command(name = "process", mixinStandardHelpOptions = true, description = "Process an email from a JSON file")
@Component
public class ProcessCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the email JSON file")
    private Path file;

    private final ConversationEngine engine;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public ProcessCommand(ConversationEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        InboundEmail email;
        try {
            email = mapper.readValue(file.toFile(), EmailRequest.class).toEmail(clock.instant());
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 2;
        }
        ConsoleOutput.info("Processing message from " + email.sender() + "...");
        ConversationSnapshot snapshot;
        try {
            snapshot = engine.start(email);
        } catch (DuplicateConversationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.conversation(snapshot);
        return 0;
    }
}
