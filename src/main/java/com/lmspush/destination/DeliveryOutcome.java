package com.lmspush.destination;

/**
 * Result of one delivery attempt. Adapters report failures through this type
 * instead of throwing.
 */
public sealed interface DeliveryOutcome {

    record Delivered(int statusCode) implements DeliveryOutcome {}

    /** Transport error or server-side (5xx) failure; the attempt may be repeated. */
    record RetryableFailure(String reason) implements DeliveryOutcome {}

    /** Client-side failure (bad credential, malformed payload); repeating will not help. */
    record FatalFailure(String reason) implements DeliveryOutcome {}

    static DeliveryOutcome delivered(int statusCode) {
        return new Delivered(statusCode);
    }

    static DeliveryOutcome retryable(String reason) {
        return new RetryableFailure(reason);
    }

    static DeliveryOutcome fatal(String reason) {
        return new FatalFailure(reason);
    }
}
