package com.lmspush.destination;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DestinationKind {
    RECORD_STORE("lrs"),
    WEBHOOK("webhook");

    private final String value;

    DestinationKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Accepts the wire value ("lrs", "webhook") or the constant name in any case,
     * with dashes or underscores ("record-store").
     */
    @JsonCreator
    public static DestinationKind fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().replace('-', '_');
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(normalized) || v.name().equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown destination kind: " + raw));
    }
}
