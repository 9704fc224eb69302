package com.lmspush.status;

import com.lmspush.push.PushRecord;

/**
 * Receives status snapshots for one push, oldest first, ending with the terminal one.
 */
public interface StatusListener {

    void onStatus(PushRecord snapshot);

    /** Called once, after the terminal snapshot has been delivered. */
    default void onComplete() {
    }
}
