package com.lmspush.api;

import com.lmspush.push.DrivePushRequest;
import com.lmspush.push.PushOrchestrator;
import com.lmspush.push.PushRequest;
import com.lmspush.push.PushStatus;
import com.lmspush.status.PushStatusStore;
import com.lmspush.status.StatusListener;
import com.lmspush.status.StatusNotifier;
import com.lmspush.status.StatusSubscription;
import com.lmspush.push.PushRecord;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/v1/pushes")
public class PushController {

    private final PushOrchestrator orchestrator;
    private final PushStatusStore statusStore;
    private final StatusNotifier notifier;
    private final Clock clock;

    public PushController(PushOrchestrator orchestrator,
                          PushStatusStore statusStore,
                          StatusNotifier notifier,
                          Clock clock) {
        this.orchestrator = orchestrator;
        this.statusStore = statusStore;
        this.notifier = notifier;
        this.clock = clock;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> submit(@RequestBody PushRequest request) {
        String pushId = orchestrator.submit(request);
        return Map.of(
            "message", "content push initiated",
            "push_id", pushId,
            "status", PushStatus.QUEUED.getValue()
        );
    }

    /**
     * Same as {@link #submit} with the content location taken from a shared drive link.
     */
    @PostMapping("/drive")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> submitFromDrive(@RequestBody DrivePushRequest request) {
        return submit(request.toPushRequest());
    }

    @GetMapping("/{pushId}")
    public PushStatusResponse status(@PathVariable String pushId) {
        return statusStore.find(pushId)
            .map(PushStatusResponse::from)
            .orElseThrow(() -> new PushNotFoundException(pushId));
    }

    @GetMapping
    public List<PushStatusResponse> query(@RequestParam(required = false) String status,
                                          @RequestParam(name = "since_hours", required = false) Integer sinceHours,
                                          @RequestParam(defaultValue = "100") int limit) {
        if (sinceHours != null && sinceHours < 0) {
            throw new IllegalArgumentException("since_hours must not be negative");
        }
        return statusStore.query(
                Optional.ofNullable(status).map(PushStatus::fromValue),
                Optional.ofNullable(sinceHours).map(h -> clock.instant().minus(Duration.ofHours(h))),
                Math.min(limit, 1000))
            .stream()
            .map(PushStatusResponse::from)
            .toList();
    }

    @GetMapping(value = "/{pushId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> stream(@PathVariable String pushId) {
        SseEmitter emitter = new SseEmitter(0L);
        Optional<StatusSubscription> subscription = notifier.subscribe(pushId, new StatusListener() {
            @Override
            public void onStatus(PushRecord snapshot) {
                try {
                    emitter.send(SseEmitter.event()
                        .name("status")
                        .data(PushStatusResponse.from(snapshot)));
                } catch (IOException ex) {
                    emitter.completeWithError(ex);
                    throw new IllegalStateException("status stream closed for push " + pushId, ex);
                }
            }

            @Override
            public void onComplete() {
                emitter.complete();
            }
        });

        if (subscription.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        StatusSubscription active = subscription.get();
        emitter.onCompletion(active::cancel);
        emitter.onTimeout(active::cancel);
        emitter.onError(ex -> active.cancel());
        return ResponseEntity.ok(emitter);
    }
}
