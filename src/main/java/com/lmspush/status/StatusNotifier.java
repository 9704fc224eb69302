package com.lmspush.status;

import com.lmspush.push.PushRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-push broadcast of status snapshots to live subscribers.
 *
 * A subscriber first receives the current snapshot, then every later one, and is
 * completed after the terminal snapshot. Snapshots are filtered by version so a
 * subscriber never sees an older snapshot after a newer one.
 *
 * Writers must store a snapshot before publishing it; {@link #subscribe} relies on the
 * store being at least as new as anything published.
 */
@Component
public class StatusNotifier {

    private static final Logger log = LoggerFactory.getLogger(StatusNotifier.class);

    private final PushStatusStore statusStore;
    private final ConcurrentHashMap<String, Channel> channels = new ConcurrentHashMap<>();

    public StatusNotifier(PushStatusStore statusStore) {
        this.statusStore = statusStore;
    }

    public void publish(PushRecord snapshot) {
        boolean terminal = snapshot.status().isTerminal();
        Channel channel = channels.computeIfAbsent(snapshot.id(), id -> new Channel());
        List<Subscriber> targets;
        synchronized (channel) {
            targets = new ArrayList<>(channel.subscribers);
            if (terminal) {
                channel.closed = true;
                channel.subscribers.clear();
                channels.remove(snapshot.id(), channel);
            }
        }

        // listeners run outside the channel monitor; a slow one must not stall subscribe or cancel
        for (Subscriber subscriber : targets) {
            if (!subscriber.offer(snapshot)) {
                channel.remove(subscriber);
            } else if (terminal) {
                subscriber.complete();
            }
        }
    }

    /**
     * @return empty if no push with this id exists
     */
    public Optional<StatusSubscription> subscribe(String pushId, StatusListener listener) {
        Optional<PushRecord> current = statusStore.find(pushId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        if (current.get().status().isTerminal()) {
            deliverFinal(listener, current.get());
            return Optional.of(StatusSubscription.CLOSED);
        }

        Channel channel = channels.computeIfAbsent(pushId, id -> new Channel());
        Subscriber subscriber = new Subscriber(listener);
        PushRecord latest;
        boolean joined = false;
        synchronized (channel) {
            latest = statusStore.find(pushId).orElse(current.get());
            if (channel.closed || latest.status().isTerminal()) {
                if (channel.subscribers.isEmpty()) {
                    channels.remove(pushId, channel);
                }
            } else {
                channel.subscribers.add(subscriber);
                joined = true;
            }
        }
        if (!joined) {
            deliverFinal(listener, latest);
            return Optional.of(StatusSubscription.CLOSED);
        }

        if (!subscriber.offer(latest)) {
            channel.remove(subscriber);
        }
        return Optional.of(() -> channel.remove(subscriber));
    }

    int activeChannels() {
        return channels.size();
    }

    private void deliverFinal(StatusListener listener, PushRecord terminal) {
        Subscriber subscriber = new Subscriber(listener);
        if (subscriber.offer(terminal)) {
            subscriber.complete();
        }
    }

    private static final class Channel {
        private final List<Subscriber> subscribers = new ArrayList<>();
        private boolean closed;

        synchronized void remove(Subscriber subscriber) {
            subscribers.remove(subscriber);
        }
    }

    /**
     * Deliveries to one listener are serialized; nothing is delivered after completion.
     */
    private static final class Subscriber {
        private final StatusListener listener;
        private long lastVersion;
        private boolean completed;

        Subscriber(StatusListener listener) {
            this.listener = listener;
        }

        /**
         * @return false if the listener failed and should be dropped
         */
        synchronized boolean offer(PushRecord snapshot) {
            if (completed || snapshot.version() <= lastVersion) {
                return true;
            }
            lastVersion = snapshot.version();
            try {
                listener.onStatus(snapshot);
                return true;
            } catch (RuntimeException ex) {
                log.warn("Status subscriber failed for push={} status={}: {}",
                    snapshot.id(), snapshot.status().getValue(), ex.getMessage());
                return false;
            }
        }

        synchronized void complete() {
            if (completed) {
                return;
            }
            completed = true;
            try {
                listener.onComplete();
            } catch (RuntimeException ex) {
                log.warn("Status subscriber completion failed: {}", ex.getMessage());
            }
        }
    }
}
