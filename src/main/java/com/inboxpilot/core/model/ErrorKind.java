package com.inboxpilot.core.model;

/**
 * Error taxonomy recorded in conversation state.
 */
public enum ErrorKind {
    /** Missing or malformed input. Handled by routing straight to the composer. */
    VALIDATION,
    /** Collaborator failure or malformed classification output. */
    EXTERNAL_SERVICE,
    /** Interrupt expired without a human response. */
    TIMEOUT,
    /** Unrecoverable failure, the conversation ends in ERROR. */
    FATAL
}
