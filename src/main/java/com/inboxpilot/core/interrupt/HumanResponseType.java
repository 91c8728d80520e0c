package com.inboxpilot.core.interrupt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HumanResponseType {
    ACCEPT("accept"),
    IGNORE("ignore"),
    RESPONSE("response"),
    EDIT("edit");

    private final String wireName;

    HumanResponseType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static HumanResponseType fromWire(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Response type is required");
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (HumanResponseType type : values()) {
            if (type.wireName.equals(key)) {
                return type;
            }
        }
        if (key.equals("respond")) {
            return RESPONSE;
        }
        throw new IllegalArgumentException("Unknown response type: " + raw);
    }
}
