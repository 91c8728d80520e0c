package com.inboxpilot.core.interrupt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reviewer answer to an {@link ActionRequest}. {@code args} is either free text or a map
 * (for {@code edit}, typically the edited action arguments).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HumanResponse(
        @JsonProperty("type") HumanResponseType type,
        @JsonProperty("args") Object args
) {

    public static HumanResponse accept() {
        return new HumanResponse(HumanResponseType.ACCEPT, null);
    }

    public static HumanResponse ignore() {
        return new HumanResponse(HumanResponseType.IGNORE, null);
    }

    public static HumanResponse respond(String text) {
        return new HumanResponse(HumanResponseType.RESPONSE, text);
    }

    public static HumanResponse edit(Map<String, Object> edited) {
        return new HumanResponse(HumanResponseType.EDIT, edited);
    }

    /**
     * Flattens {@code args} to the feedback text handed to the router.
     * A map contributes its {@code feedback}, {@code response} or {@code draft_response} entry when present,
     * otherwise every entry as {@code key: value} lines.
     */
    public String argsAsText() {
        if (args == null) {
            return "";
        }
        if (args instanceof Map<?, ?> map) {
            for (String key : new String[]{"feedback", "response", "draft_response"}) {
                Object value = map.get(key);
                if (value != null && !value.toString().isBlank()) {
                    return key.equals("draft_response")
                            ? "Use this edited draft: " + value
                            : value.toString();
                }
            }
            return map.entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining("\n"));
        }
        return args.toString();
    }
}
