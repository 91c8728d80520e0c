package com.inboxpilot.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing conversation-scoped MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setConversation(String conversationId, int epoch) {
        MDC.put("conversationId", conversationId);
        MDC.put("epoch", String.valueOf(epoch));
    }

    public static void setStage(String stage) {
        MDC.put("stage", stage);
    }

    public static void clearStage() {
        MDC.remove("stage");
    }

    public static void clear() {
        MDC.remove("conversationId");
        MDC.remove("epoch");
        MDC.remove("stage");
    }
}
