package com.lmspush.status;

import com.lmspush.push.PushRecord;
import com.lmspush.push.PushStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keyed store of push snapshots. Writes are whole-record replacements; readers always
 * see a complete snapshot.
 */
public interface PushStatusStore {

    /**
     * @throws IllegalStateException if a push with the same id already exists
     */
    void create(PushRecord record);

    /**
     * Replaces the stored snapshot for {@code next.id()}.
     *
     * @throws IllegalStateException if the push is unknown, already terminal,
     *                               or {@code next} is not newer than the stored snapshot
     */
    void replace(PushRecord next);

    Optional<PushRecord> find(String pushId);

    /**
     * Newest first.
     */
    List<PushRecord> query(Optional<PushStatus> status, Optional<Instant> createdSince, int limit);

    default List<PushRecord> findCreatedSince(Instant since, int limit) {
        return query(Optional.empty(), Optional.of(since), limit);
    }

    default List<PushRecord> findByStatus(PushStatus status, int limit) {
        return query(Optional.of(status), Optional.empty(), limit);
    }
}
