package com.lmspush.content;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ContentType {
    ESSAY("essay"),
    VIDEO("video"),
    AUDIO("audio"),
    PRESENTATION("presentation"),
    CODE("code"),
    QUIZ("quiz"),
    PROJECT("project");

    private final String value;

    ContentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ContentType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown content type: " + raw));
    }
}
