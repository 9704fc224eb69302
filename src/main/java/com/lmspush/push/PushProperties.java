package com.lmspush.push;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "lmspush.push")
public record PushProperties(
    @DefaultValue("3") int maxRetries,
    @DefaultValue("1s") Duration initialBackoff,
    @DefaultValue("2.0") double backoffMultiplier,
    @DefaultValue("30s") Duration maxBackoff,
    @DefaultValue("8") int workerThreads
) {

    RetryPolicy toRetryPolicy() {
        return new RetryPolicy(maxRetries, initialBackoff, backoffMultiplier, maxBackoff);
    }
}
