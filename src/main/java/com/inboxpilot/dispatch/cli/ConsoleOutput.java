package com.inboxpilot.dispatch.cli;

import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.persistence.ConversationSnapshot;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the InboxPilot CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) INBOXPILOT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [INBOX]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void conversation(ConversationSnapshot snapshot) {
        System.out.println();
        System.out.println("CONVERSATION " + snapshot.conversationId());
        if (snapshot.request() != null) {
            System.out.println("From: " + snapshot.request().sender());
            System.out.println("Subject: " + snapshot.request().subject());
        }
        String status = "Status: " + snapshot.status() + " (epoch " + snapshot.epoch() + ")"
                + (snapshot.archived() ? " [archived]" : "");
        switch (snapshot.status()) {
            case COMPLETED, APPROVED -> success(status);
            case ERROR, REJECTED -> error(status);
            default -> info(status);
        }

        if (!snapshot.taskData().isEmpty()) {
            System.out.println();
            System.out.printf("  %-12s %-10s %s%n", "STAGE", "MARKER", "SUMMARY");
            System.out.println("  " + "-".repeat(56));
            snapshot.taskData().forEach((stage, result) ->
                    System.out.printf("  %-12s %-10s %s%n", stage.wireName(), result.marker(), result.summary()));
        }

        if (snapshot.draftOutput() != null && !snapshot.draftOutput().isBlank()) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Draft|@"));
            System.out.println(snapshot.draftOutput());
        }

        if (snapshot.isAwaitingInput()) {
            var request = snapshot.pendingInterrupt().request();
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|bold,fg(yellow) [AWAITING]|@ " + request.action()));
            System.out.println("  Allowed: "
                    + (request.allowAccept() ? "accept " : "")
                    + (request.allowIgnore() ? "ignore " : "")
                    + (request.allowRespond() ? "response " : "")
                    + (request.allowEdit() ? "edit" : ""));
            if (snapshot.pendingInterrupt().deadline() != null) {
                System.out.println("  Deadline: " + snapshot.pendingInterrupt().deadline());
            }
        }

        if (!snapshot.errors().isEmpty()) {
            System.out.println();
            error("Errors (" + snapshot.errors().size() + "):");
            for (StageError e : snapshot.errors()) {
                error("  " + e.stage() + " [" + e.kind() + "] " + e.message());
            }
        }
    }
}
