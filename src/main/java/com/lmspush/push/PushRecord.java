package com.lmspush.push;

import com.lmspush.content.ContentRecord;

import java.time.Instant;

/**
 * Immutable snapshot of one push. Every transition produces a new snapshot with
 * {@code version} incremented; the status store only ever replaces whole snapshots.
 *
 * @param retryCount   failed retryable attempts so far
 * @param lastError    most recent delivery or configuration error, null if none
 * @param filterReason why the filter passed or rejected the content, null when bypassed
 */
public record PushRecord(
    String id,
    ContentRecord content,
    String destination,
    boolean forcePush,
    PushStatus status,
    int retryCount,
    PushError lastError,
    String filterReason,
    Instant createdAt,
    Instant updatedAt,
    long version
) {

    public static PushRecord queued(String id, PushRequest request, Instant now) {
        return new PushRecord(id, request.content(), request.destination(), request.forcePush(),
            PushStatus.QUEUED, 0, null, null, now, now, 1);
    }

    public PushRecord filteredOut(Instant now, String reason) {
        return next(PushStatus.FILTERED_OUT, retryCount, lastError, reason, now);
    }

    public PushRecord inProgress(Instant now, String passedFilterReason) {
        return next(PushStatus.IN_PROGRESS, retryCount, lastError, passedFilterReason, now);
    }

    public PushRecord retrying(Instant now, int newRetryCount, PushError error) {
        return next(PushStatus.IN_PROGRESS, newRetryCount, error, filterReason, now);
    }

    public PushRecord delivered(Instant now) {
        return next(PushStatus.DELIVERED, retryCount, lastError, filterReason, now);
    }

    public PushRecord failed(Instant now, PushError error) {
        return failed(now, retryCount, error);
    }

    public PushRecord failed(Instant now, int finalRetryCount, PushError error) {
        return next(PushStatus.FAILED, finalRetryCount, error, filterReason, now);
    }

    private PushRecord next(PushStatus nextStatus, int nextRetryCount, PushError error,
                            String reason, Instant now) {
        if (!status.canTransitionTo(nextStatus)) {
            throw new IllegalStateException("push " + id + " cannot move from "
                + status.getValue() + " to " + nextStatus.getValue());
        }
        return new PushRecord(id, content, destination, forcePush, nextStatus, nextRetryCount,
            error, reason, createdAt, now, version + 1);
    }
}
