package com.lmspush.push;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Error captured on a push record: message plus classification.
 */
public record PushError(
    @JsonProperty("message") String message,
    @JsonProperty("kind") Kind kind
) {

    public enum Kind {
        CONFIGURATION("configuration"),
        RETRYABLE_DELIVERY("retryable_delivery"),
        FATAL_DELIVERY("fatal_delivery"),
        INTERRUPTED("interrupted"),
        INTERNAL("internal");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    public static PushError configuration(String message) {
        return new PushError(message, Kind.CONFIGURATION);
    }
}
