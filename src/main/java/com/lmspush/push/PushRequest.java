package com.lmspush.push;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lmspush.content.ContentRecord;

/**
 * One request to deliver one content record to one named destination.
 * {@code forcePush} bypasses filtering for this push only.
 */
public record PushRequest(
    @JsonProperty("content") ContentRecord content,
    @JsonProperty("destination") String destination,
    @JsonProperty("force_push") boolean forcePush
) {}
