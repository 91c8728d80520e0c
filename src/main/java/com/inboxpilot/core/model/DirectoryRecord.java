package com.inboxpilot.core.model;

import java.io.Serializable;

/**
 * A single hit from the contact directory or document repository.
 */
public record DirectoryRecord(
        String source,
        String id,
        String title,
        String content
) implements Serializable {}
