package com.lmspush.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lmspush.push.PushError;
import com.lmspush.push.PushRecord;
import com.lmspush.push.PushStatus;

import java.time.Instant;

/**
 * Push snapshot as returned to pollers and subscribers.
 */
public record PushStatusResponse(
    @JsonProperty("id") String id,
    @JsonProperty("status") PushStatus status,
    @JsonProperty("destination") String destination,
    @JsonProperty("learner_id") String learnerId,
    @JsonProperty("content_id") String contentId,
    @JsonProperty("force_push") boolean forcePush,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("last_error") PushError lastError,
    @JsonProperty("filter_reason") String filterReason,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("version") long version
) {

    public static PushStatusResponse from(PushRecord record) {
        return new PushStatusResponse(
            record.id(),
            record.status(),
            record.destination(),
            record.content().learnerId(),
            record.content().contentId(),
            record.forcePush(),
            record.retryCount(),
            record.lastError(),
            record.filterReason(),
            record.createdAt(),
            record.updatedAt(),
            record.version());
    }
}
