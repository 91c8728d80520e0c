package com.inboxpilot.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically expires interrupts nobody answered in time.
 */
@Component
public class InterruptTimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(InterruptTimeoutSweeper.class);

    private final ConversationEngine engine;

    public InterruptTimeoutSweeper(ConversationEngine engine) {
        this.engine = engine;
    }

    @Scheduled(fixedDelayString = "${inbox.interrupt.sweep-interval-ms:60000}",
            initialDelayString = "${inbox.interrupt.sweep-interval-ms:60000}")
    public void sweep() {
        int expired = engine.expireOverdue();
        if (expired > 0) {
            log.info("Expired {} overdue interrupt(s)", expired);
        }
    }
}
