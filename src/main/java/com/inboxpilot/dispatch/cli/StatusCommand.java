package com.inboxpilot.dispatch.cli;

import com.inboxpilot.core.engine.ConversationEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: inboxpilot status [&lt;conversation-id&gt;] [--awaiting]
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show conversation status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Conversation ID")
    private String conversationId;

    @Option(names = {"--awaiting"}, description = "List conversations waiting for a human")
    private boolean awaiting;

    private final ConversationEngine engine;

    public StatusCommand(ConversationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (awaiting || conversationId == null) {
            var list = engine.listAwaiting();
            if (list.isEmpty()) {
                ConsoleOutput.info("No conversations are waiting for input.");
            }
            list.forEach(snapshot -> ConsoleOutput.info(snapshot.conversationId() + "  "
                    + snapshot.pendingInterrupt().point() + "  " + snapshot.pendingInterrupt().request().action()));
            return 0;
        }
        var snapshot = engine.get(conversationId);
        if (snapshot.isEmpty()) {
            ConsoleOutput.error("Conversation not found: " + conversationId);
            return 1;
        }
        ConsoleOutput.conversation(snapshot.get());
        return 0;
    }
}
