package com.lmspush.content;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Letter grade on the ordinal scale F &lt; D &lt; C &lt; B &lt; A.
 * Declaration order is the ordering used for threshold checks.
 */
public enum Grade {
    F, D, C, B, A;

    public boolean isAtLeast(Grade threshold) {
        return compareTo(threshold) >= 0;
    }

    @JsonValue
    public String getValue() {
        return name();
    }

    /**
     * Case-insensitive parse. A blank grade is treated as "no grade".
     */
    @JsonCreator
    public static Grade fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim();
        return Arrays.stream(values())
            .filter(g -> g.name().equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown grade: " + raw));
    }
}
