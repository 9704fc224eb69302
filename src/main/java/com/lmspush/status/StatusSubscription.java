package com.lmspush.status;

@FunctionalInterface
public interface StatusSubscription {

    StatusSubscription CLOSED = () -> { };

    /** Detaches the listener. Safe to call more than once. */
    void cancel();
}
