package com.lmspush.destination;

import com.lmspush.content.ContentRecord;
import com.lmspush.statement.ActivityStatement;

/**
 * Delivers a statement to one kind of destination.
 *
 * Implementations are stateless per call and shared by all push workers, so
 * concurrent deliveries to the same destination must be safe. Delivery problems
 * are returned as {@link DeliveryOutcome} failures, not thrown.
 */
public interface DestinationAdapter {

    /** The destination kind this adapter serves; one adapter per kind. */
    DestinationKind kind();

    DeliveryOutcome deliver(ActivityStatement statement, ContentRecord content, DestinationConfig destination);
}
