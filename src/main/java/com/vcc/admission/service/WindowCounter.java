package com.vcc.admission.service;

import com.vcc.admission.config.AdmissionProperties;
import com.vcc.admission.model.FailurePolicy;
import com.vcc.admission.model.LayerScope;
import com.vcc.admission.model.RateWindow;
import com.vcc.admission.model.WindowDecision;
import com.vcc.admission.model.WindowKey;
import com.vcc.admission.store.StoreUnavailableException;
import com.vcc.admission.store.WindowCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Entry point to the window counter store for the IP and identity layers. Bounds every
 * store call with a timeout and turns any store failure into a decision through the
 * configured {@link FailurePolicy}, so callers never see a store error.
 */
@Service
public class WindowCounter {
    private static final Logger log = LoggerFactory.getLogger(WindowCounter.class);

    private final WindowCounterStore store;
    private final Clock clock;
    private final Duration timeout;
    private final FailurePolicy failurePolicy;

    public WindowCounter(WindowCounterStore store, Clock clock, AdmissionProperties properties) {
        this.store = store;
        this.clock = clock;
        this.timeout = Duration.ofMillis(properties.getStore().getTimeoutMillis());
        this.failurePolicy = properties.getStore().getFailurePolicy();
        log.info("WindowCounter initialized with store={}, timeout={}, failurePolicy={}",
                store.getClass().getSimpleName(), timeout, failurePolicy);
    }

    /**
     * Check and count one attempt for the subject.
     */
    public Mono<WindowDecision> checkAndIncrement(LayerScope scope, String subject, long limit, Duration windowSize) {
        WindowKey key = new WindowKey(scope, subject);
        return Mono.defer(() -> store.checkAndIncrement(key, limit, windowSize))
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new StoreUnavailableException("Window store returned no decision")))
                .onErrorResume(e -> Mono.just(onStoreFailure(key, limit, windowSize, e)));
    }

    /**
     * Read-only view of the subject's current window.
     */
    public Mono<RateWindow> find(LayerScope scope, String subject) {
        return store.find(new WindowKey(scope, subject)).timeout(timeout);
    }

    private WindowDecision onStoreFailure(WindowKey key, long limit, Duration windowSize, Throwable error) {
        Instant now = clock.instant();
        Instant resetAt = WindowCounterStore.windowStart(now, windowSize).plus(windowSize);
        Duration resetAfter = Duration.between(now, resetAt);

        if (failurePolicy == FailurePolicy.FAIL_OPEN) {
            log.warn("Window store unavailable for {}, admitting (FAIL_OPEN): {}",
                    key.asString(), describe(error));
            return new WindowDecision(true, 0, limit, resetAfter, resetAt, true);
        }
        log.error("Window store unavailable for {}, rejecting (FAIL_CLOSED): {}",
                key.asString(), describe(error));
        return new WindowDecision(false, 0, limit, resetAfter, resetAt, true);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
