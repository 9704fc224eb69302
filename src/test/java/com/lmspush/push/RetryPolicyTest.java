package com.lmspush.push;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaults_matchDocumentedValues() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertEquals(3, policy.maxRetries());
        assertEquals(Duration.ofSeconds(1), policy.initialBackoff());
        assertEquals(2.0, policy.multiplier());
        assertEquals(Duration.ofSeconds(30), policy.maxBackoff());
    }

    @Test
    void allowsRetry_untilCountReachesMax() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertTrue(policy.allowsRetry(0));
        assertTrue(policy.allowsRetry(2));
        assertFalse(policy.allowsRetry(3));
        assertFalse(policy.allowsRetry(4));
    }

    @Test
    void backoff_growsExponentially() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertEquals(Duration.ofSeconds(1), policy.backoffFor(1));
        assertEquals(Duration.ofSeconds(2), policy.backoffFor(2));
        assertEquals(Duration.ofSeconds(4), policy.backoffFor(3));
        assertEquals(Duration.ZERO, policy.backoffFor(0));
    }

    @Test
    void backoff_isCappedAtMax() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5));
        assertEquals(Duration.ofSeconds(4), policy.backoffFor(3));
        assertEquals(Duration.ofSeconds(5), policy.backoffFor(4));
        assertEquals(Duration.ofSeconds(5), policy.backoffFor(60));
    }

    @Test
    void invalidSettings_areRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(0, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30)));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ofSeconds(-1), 2.0, Duration.ofSeconds(30)));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ofSeconds(1), 0.5, Duration.ofSeconds(30)));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ofSeconds(10), 2.0, Duration.ofSeconds(5)));
    }
}
