package com.lmspush.push;

import com.lmspush.content.ContentRecordValidator;
import com.lmspush.content.ContentValidationException;
import com.lmspush.destination.DeliveryOutcome;
import com.lmspush.destination.DestinationAdapter;
import com.lmspush.destination.DestinationAdapters;
import com.lmspush.destination.DestinationConfig;
import com.lmspush.destination.DestinationService;
import com.lmspush.filter.FilterDecision;
import com.lmspush.filter.FilterEngine;
import com.lmspush.filter.FilterRule;
import com.lmspush.filter.FilterRuleRepository;
import com.lmspush.statement.ActivityStatement;
import com.lmspush.statement.StatementGenerator;
import com.lmspush.status.PushStatusStore;
import com.lmspush.status.StatusNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives each push through its lifecycle.
 *
 * {@link #submit} validates, records the push as queued and hands it to the worker pool;
 * it never waits for delivery. The worker resolves the destination, applies the
 * destination's filter rule (unless forced), generates a statement and delivers it,
 * retrying retryable failures with backoff. Every transition is stored and then
 * published to subscribers.
 *
 * Each push id is owned by exactly one worker run, so the store never sees two
 * writers for the same id.
 */
@Service
public class PushOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PushOrchestrator.class);

    private final ContentRecordValidator contentValidator;
    private final DestinationService destinations;
    private final FilterRuleRepository filterRules;
    private final FilterEngine filterEngine;
    private final StatementGenerator statementGenerator;
    private final DestinationAdapters adapters;
    private final PushStatusStore statusStore;
    private final StatusNotifier notifier;
    private final RetryPolicy retryPolicy;
    private final Executor pushWorkerPool;
    private final Clock clock;

    public PushOrchestrator(ContentRecordValidator contentValidator,
                            DestinationService destinations,
                            FilterRuleRepository filterRules,
                            FilterEngine filterEngine,
                            StatementGenerator statementGenerator,
                            DestinationAdapters adapters,
                            PushStatusStore statusStore,
                            StatusNotifier notifier,
                            RetryPolicy retryPolicy,
                            @Qualifier("pushWorkerPool") Executor pushWorkerPool,
                            Clock clock) {
        this.contentValidator = contentValidator;
        this.destinations = destinations;
        this.filterRules = filterRules;
        this.filterEngine = filterEngine;
        this.statementGenerator = statementGenerator;
        this.adapters = adapters;
        this.statusStore = statusStore;
        this.notifier = notifier;
        this.retryPolicy = retryPolicy;
        this.pushWorkerPool = pushWorkerPool;
        this.clock = clock;
    }

    /**
     * Accepts a push and returns its id. Delivery happens after this returns.
     *
     * @throws ContentValidationException if the request is malformed
     */
    public String submit(PushRequest request) {
        if (request == null) {
            throw new ContentValidationException("push request is required");
        }
        if (request.destination() == null || request.destination().isBlank()) {
            throw new ContentValidationException("destination is required");
        }
        contentValidator.validate(request.content());

        PushRecord queued = PushRecord.queued(UUID.randomUUID().toString(), request, clock.instant());
        statusStore.create(queued);
        notifier.publish(queued);
        log.info("Push {} queued: content={} learner={} destination={} force={}",
            queued.id(), request.content().contentId(), request.content().learnerId(),
            request.destination(), request.forcePush());

        try {
            pushWorkerPool.execute(() -> run(queued));
        } catch (RejectedExecutionException ex) {
            log.warn("Push {} rejected by worker pool: {}", queued.id(), ex.getMessage());
            transition(queued.failed(clock.instant(),
                new PushError("push worker pool is not accepting work", PushError.Kind.INTERNAL)));
        }
        return queued.id();
    }

    void run(PushRecord queued) {
        try {
            process(queued);
        } catch (RuntimeException ex) {
            log.error("Push {} aborted by unexpected error", queued.id(), ex);
            PushRecord latest = statusStore.find(queued.id()).orElse(queued);
            if (!latest.status().isTerminal()) {
                transition(latest.failed(clock.instant(),
                    new PushError("unexpected error: " + ex.getMessage(), PushError.Kind.INTERNAL)));
            }
        }
    }

    private void process(PushRecord queued) {
        Optional<DestinationConfig> destination = destinations.find(queued.destination());
        if (destination.isEmpty()) {
            failConfiguration(queued, "unknown destination: " + queued.destination());
            return;
        }
        DestinationConfig config = destination.get();

        Optional<DestinationAdapter> adapter = adapters.forKind(config.kind());
        if (adapter.isEmpty()) {
            failConfiguration(queued, "no adapter for destination kind: " + config.kind().getValue());
            return;
        }

        String filterReason = null;
        if (!queued.forcePush()) {
            Optional<FilterRule> rule = Optional.empty();
            if (config.hasRule()) {
                rule = filterRules.findById(config.ruleId());
                if (rule.isEmpty()) {
                    failConfiguration(queued, "unknown filter rule " + config.ruleId()
                        + " referenced by destination " + config.name());
                    return;
                }
            }
            FilterDecision decision = filterEngine.evaluate(queued.content(), rule.filter(FilterRule::isActive));
            if (!decision.passed()) {
                transition(queued.filteredOut(clock.instant(), decision.reason()));
                log.info("Push {} filtered out: {}", queued.id(), decision.reason());
                return;
            }
            filterReason = decision.reason();
        }

        deliverWithRetry(transition(queued.inProgress(clock.instant(), filterReason)), config, adapter.get());
    }

    private void deliverWithRetry(PushRecord inProgress, DestinationConfig config, DestinationAdapter adapter) {
        PushRecord current = inProgress;
        while (true) {
            ActivityStatement statement = statementGenerator.generate(current.content());
            DeliveryOutcome outcome = adapter.deliver(statement, current.content(), config);

            if (outcome instanceof DeliveryOutcome.Delivered delivered) {
                transition(current.delivered(clock.instant()));
                log.info("Push {} delivered to {} (HTTP {}, statement={}, retries={})",
                    current.id(), config.name(), delivered.statusCode(), statement.id(), current.retryCount());
                return;
            }

            if (outcome instanceof DeliveryOutcome.FatalFailure fatal) {
                transition(current.failed(clock.instant(),
                    new PushError(fatal.reason(), PushError.Kind.FATAL_DELIVERY)));
                log.warn("Push {} failed permanently: {}", current.id(), fatal.reason());
                return;
            }

            DeliveryOutcome.RetryableFailure retryable = (DeliveryOutcome.RetryableFailure) outcome;
            int retryCount = current.retryCount() + 1;
            PushError error = new PushError(retryable.reason(), PushError.Kind.RETRYABLE_DELIVERY);
            if (!retryPolicy.allowsRetry(retryCount)) {
                transition(current.failed(clock.instant(), retryCount, error));
                log.warn("Push {} failed after {} retryable failures: {}",
                    current.id(), retryCount, retryable.reason());
                return;
            }

            current = transition(current.retrying(clock.instant(), retryCount, error));
            Duration backoff = retryPolicy.backoffFor(retryCount);
            log.warn("Push {} attempt {} failed, retrying in {} ms: {}",
                current.id(), retryCount, backoff.toMillis(), retryable.reason());
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                transition(current.failed(clock.instant(),
                    new PushError("delivery interrupted by shutdown", PushError.Kind.INTERRUPTED)));
                log.warn("Push {} interrupted during backoff", current.id());
                return;
            }
        }
    }

    private void failConfiguration(PushRecord queued, String message) {
        transition(queued.failed(clock.instant(), PushError.configuration(message)));
        log.warn("Push {} failed: {}", queued.id(), message);
    }

    private PushRecord transition(PushRecord next) {
        statusStore.replace(next);
        notifier.publish(next);
        return next;
    }
}
