package com.uptimesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CheckStatus {
    UP("up"),
    DOWN("down"),
    UNKNOWN("unknown");

    private final String id;

    CheckStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static CheckStatus fromId(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Check status is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CheckStatus status : values()) {
            if (status.id.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown check status: " + raw);
    }

    @Override
    public String toString() {
        return id;
    }
}
