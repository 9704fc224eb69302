package com.lmspush.status;

import com.lmspush.push.PushRecord;
import com.lmspush.push.PushStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryPushStatusStore implements PushStatusStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPushStatusStore.class);

    private final ConcurrentHashMap<String, PushRecord> records = new ConcurrentHashMap<>();

    @Override
    public void create(PushRecord record) {
        if (records.putIfAbsent(record.id(), record) != null) {
            throw new IllegalStateException("push already exists: " + record.id());
        }
    }

    @Override
    public void replace(PushRecord next) {
        records.compute(next.id(), (id, existing) -> {
            if (existing == null) {
                throw new IllegalStateException("unknown push: " + id);
            }
            if (existing.status().isTerminal()) {
                throw new IllegalStateException("push " + id + " is already "
                    + existing.status().getValue() + " and cannot change");
            }
            if (next.version() <= existing.version()) {
                throw new IllegalStateException("stale write for push " + id + ": version "
                    + next.version() + " does not follow " + existing.version());
            }
            return next;
        });
    }

    @Override
    public Optional<PushRecord> find(String pushId) {
        if (pushId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(pushId));
    }

    @Override
    public List<PushRecord> query(Optional<PushStatus> status, Optional<Instant> createdSince, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return records.values().stream()
            .filter(r -> status.map(s -> s == r.status()).orElse(true))
            .filter(r -> createdSince.map(since -> !r.createdAt().isBefore(since)).orElse(true))
            .sorted(Comparator.comparing(PushRecord::createdAt).reversed())
            .limit(limit)
            .toList();
    }

    @PreDestroy
    public void close() {
        log.info("Discarding {} push records on shutdown", records.size());
        records.clear();
    }
}
