package com.lmspush.status;

import com.lmspush.content.ContentFixtures;
import com.lmspush.content.Grade;
import com.lmspush.push.PushError;
import com.lmspush.push.PushRecord;
import com.lmspush.push.PushRequest;
import com.lmspush.push.PushStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPushStatusStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

    private InMemoryPushStatusStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryPushStatusStore();
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        void create_thenFind() {
            PushRecord queued = queued("p-1", T0);
            store.create(queued);
            assertEquals(queued, store.find("p-1").orElseThrow());
            assertTrue(store.find("p-2").isEmpty());
            assertTrue(store.find(null).isEmpty());
        }

        @Test
        void create_duplicateId_isRejected() {
            store.create(queued("p-1", T0));
            assertThrows(IllegalStateException.class, () -> store.create(queued("p-1", T0)));
        }

        @Test
        void replace_storesNewerSnapshot() {
            PushRecord queued = queued("p-1", T0);
            store.create(queued);
            PushRecord running = queued.inProgress(T0.plusSeconds(1), "no filter rule configured");

            store.replace(running);

            assertEquals(PushStatus.IN_PROGRESS, store.find("p-1").orElseThrow().status());
            assertEquals(2, store.find("p-1").orElseThrow().version());
        }

        @Test
        void replace_unknownPush_isRejected() {
            PushRecord orphan = queued("p-9", T0).inProgress(T0, null);
            assertThrows(IllegalStateException.class, () -> store.replace(orphan));
        }

        @Test
        void replace_staleSnapshot_isRejected() {
            PushRecord queued = queued("p-1", T0);
            store.create(queued);
            PushRecord running = queued.inProgress(T0.plusSeconds(1), null);
            store.replace(running);
            store.replace(running.retrying(T0.plusSeconds(2), 1,
                new PushError("HTTP 503", PushError.Kind.RETRYABLE_DELIVERY)));

            assertThrows(IllegalStateException.class,
                () -> store.replace(running.delivered(T0.plusSeconds(3))));
        }

        @Test
        void terminalRecord_neverChanges() {
            PushRecord queued = queued("p-1", T0);
            store.create(queued);
            PushRecord filtered = queued.filteredOut(T0.plusSeconds(1), "below threshold");
            store.replace(filtered);

            PushRecord forged = new PushRecord("p-1", queued.content(), queued.destination(), false,
                PushStatus.IN_PROGRESS, 0, null, null, T0, T0.plusSeconds(2), 9);

            assertThrows(IllegalStateException.class, () -> store.replace(forged));
            assertEquals(filtered, store.find("p-1").orElseThrow());
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @BeforeEach
        void seed() {
            store.create(queued("old", T0));
            PushRecord mid = queued("mid", T0.plusSeconds(3600));
            store.create(mid);
            store.replace(mid.failed(T0.plusSeconds(3601), PushError.configuration("unknown destination: x")));
            store.create(queued("new", T0.plusSeconds(7200)));
        }

        @Test
        void newestFirst() {
            assertEquals(List.of("new", "mid", "old"), ids(store.query(Optional.empty(), Optional.empty(), 10)));
        }

        @Test
        void byStatus() {
            assertEquals(List.of("mid"), ids(store.findByStatus(PushStatus.FAILED, 10)));
            assertEquals(List.of("new", "old"), ids(store.findByStatus(PushStatus.QUEUED, 10)));
        }

        @Test
        void createdSince_isInclusive() {
            assertEquals(List.of("new", "mid"), ids(store.findCreatedSince(T0.plusSeconds(3600), 10)));
        }

        @Test
        void limit_isApplied() {
            assertEquals(List.of("new"), ids(store.query(Optional.empty(), Optional.empty(), 1)));
            assertTrue(store.query(Optional.empty(), Optional.empty(), 0).isEmpty());
        }
    }

    private static List<String> ids(List<PushRecord> records) {
        return records.stream().map(PushRecord::id).toList();
    }

    private static PushRecord queued(String id, Instant at) {
        return PushRecord.queued(id, new PushRequest(ContentFixtures.essay(Grade.B), "main_lrs", false), at);
    }
}
