package com.inboxpilot.dispatch.cli;

import com.inboxpilot.core.engine.ConversationEngine;
import com.inboxpilot.core.engine.ConversationNotFoundException;
import com.inboxpilot.core.engine.NotAwaitingInputException;
import com.inboxpilot.core.interrupt.HumanResponse;
import com.inboxpilot.core.interrupt.HumanResponseType;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: inboxpilot resume &lt;conversation-id&gt; --type accept|ignore|response|edit [--args text]
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Answer a pending review")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Conversation ID")
    private String conversationId;

    @Option(names = {"--type", "-t"}, required = true, description = "accept, ignore, response or edit")
    private String type;

    @Option(names = {"--args", "-a"}, description = "Feedback text for response/edit")
    private String args;

    private final ConversationEngine engine;

    public ResumeCommand(ConversationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var response = new HumanResponse(HumanResponseType.fromWire(type), args);
            ConsoleOutput.conversation(engine.resume(conversationId, response));
            return 0;
        } catch (ConversationNotFoundException | NotAwaitingInputException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid response: " + e.getMessage());
            return 2;
        }
    }
}
