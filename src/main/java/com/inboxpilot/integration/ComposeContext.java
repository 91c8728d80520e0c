package com.inboxpilot.integration;

import com.inboxpilot.core.model.DirectoryRecord;
import com.inboxpilot.core.model.ExtractedContext;
import com.inboxpilot.core.model.InboundEmail;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything the composer may see. Subjects of other calendar events are deliberately
 * absent: availability is described only through {@code availability} and {@code alternatives}.
 *
 * @param email         the original request
 * @param context       parsed context, null when parsing failed
 * @param availability  human-readable scheduling result, empty when no scheduling ran
 * @param alternatives  suggested alternative start times
 * @param knowledge     document hits
 * @param contacts      directory hits
 * @param gaps          missing information to acknowledge in the reply
 * @param previousDraft draft being revised, empty on the first pass
 * @param feedback      reviewer feedback to address, oldest first
 */
public record ComposeContext(
        InboundEmail email,
        ExtractedContext context,
        String availability,
        List<LocalDateTime> alternatives,
        List<DirectoryRecord> knowledge,
        List<DirectoryRecord> contacts,
        List<String> gaps,
        String previousDraft,
        List<String> feedback
) {

    public boolean isRevision() {
        return previousDraft != null && !previousDraft.isBlank() && !feedback.isEmpty();
    }
}
