package com.inboxpilot.core.model;

/**
 * Authoritative per-stage completion flag kept in {@code taskData}.
 * Routing bookkeeping never writes it.
 */
public enum CompletionMarker {
    PENDING,
    SUCCESS,
    FAILED
}
