package com.inboxpilot.core.interrupt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;

/**
 * Structured request shown to the human reviewer when execution suspends.
 * Field names on the wire are fixed for compatibility with external reviewer UIs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionRequest(
        @JsonProperty("action") String action,
        @JsonProperty("args") Map<String, Object> args,
        @JsonProperty("allow_accept") boolean allowAccept,
        @JsonProperty("allow_ignore") boolean allowIgnore,
        @JsonProperty("allow_respond") boolean allowRespond,
        @JsonProperty("allow_edit") boolean allowEdit,
        @JsonProperty("timeout_seconds") Integer timeoutSeconds
) implements Serializable {

    public ActionRequest {
        args = args == null ? Map.of() : Map.copyOf(args);
    }

    public boolean allows(HumanResponseType type) {
        return switch (type) {
            case ACCEPT -> allowAccept;
            case IGNORE -> allowIgnore;
            case RESPONSE -> allowRespond;
            case EDIT -> allowEdit;
        };
    }
}
