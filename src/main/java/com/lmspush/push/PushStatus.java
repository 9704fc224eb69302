package com.lmspush.push;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Push lifecycle.
 *
 * <pre>
 *   QUEUED ──filter rejects──▶ FILTERED_OUT
 *     │  └──configuration error──▶ FAILED
 *     ▼
 *   IN_PROGRESS ──(retry)──▶ IN_PROGRESS
 *     ├──delivered──▶ DELIVERED
 *     └──fatal / retries exhausted──▶ FAILED
 * </pre>
 *
 * FILTERED_OUT, DELIVERED and FAILED are terminal.
 */
public enum PushStatus {
    QUEUED("queued"),
    FILTERED_OUT("filtered_out"),
    IN_PROGRESS("in_progress"),
    DELIVERED("delivered"),
    FAILED("failed");

    private final String value;

    PushStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == FILTERED_OUT || this == DELIVERED || this == FAILED;
    }

    public boolean canTransitionTo(PushStatus next) {
        return allowedNext().contains(next);
    }

    private Set<PushStatus> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(FILTERED_OUT, IN_PROGRESS, FAILED);
            case IN_PROGRESS -> EnumSet.of(IN_PROGRESS, DELIVERED, FAILED);
            case FILTERED_OUT, DELIVERED, FAILED -> EnumSet.noneOf(PushStatus.class);
        };
    }

    @JsonCreator
    public static PushStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().replace('-', '_');
        return Arrays.stream(values())
            .filter(s -> s.value.equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown push status: " + raw));
    }
}
