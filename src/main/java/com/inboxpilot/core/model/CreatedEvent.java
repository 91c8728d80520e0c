package com.inboxpilot.core.model;

import java.io.Serializable;

public record CreatedEvent(String id, String link) implements Serializable {}
