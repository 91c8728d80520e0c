package com.inboxpilot.core.model;

import java.io.Serializable;

public record StageError(String stage, ErrorKind kind, String message) implements Serializable {

    public static StageError of(StageKind stage, ErrorKind kind, String message) {
        return new StageError(stage.wireName(), kind, message);
    }
}
