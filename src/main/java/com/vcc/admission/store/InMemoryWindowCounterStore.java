package com.vcc.admission.store;

import com.vcc.admission.model.RateWindow;
import com.vcc.admission.model.WindowDecision;
import com.vcc.admission.model.WindowKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Single-process window store. {@link ConcurrentHashMap#compute} runs the compare and
 * the increment under the key's bin lock, which makes each check atomic per subject.
 * Not shared between instances; use {@link RedisWindowCounterStore} for that.
 */
public class InMemoryWindowCounterStore implements WindowCounterStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryWindowCounterStore.class);

    private final Map<WindowKey, RateWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryWindowCounterStore(Clock clock) {
        this.clock = clock;
        log.info("InMemoryWindowCounterStore initialized (single instance only)");
    }

    @Override
    public Mono<WindowDecision> checkAndIncrement(WindowKey key, long limit, Duration windowSize) {
        return Mono.fromSupplier(() -> apply(key, limit, windowSize));
    }

    private WindowDecision apply(WindowKey key, long limit, Duration windowSize) {
        Instant now = clock.instant();
        Instant start = WindowCounterStore.windowStart(now, windowSize);
        AtomicBoolean admitted = new AtomicBoolean(false);

        RateWindow window = windows.compute(key, (k, existing) -> {
            RateWindow current = existing;
            // A newer window supersedes the old row; an existing row that is ahead of
            // this node's clock is kept so skew never rewinds a count
            if (current == null || current.windowStart().isBefore(start)) {
                current = new RateWindow(k, start, windowSize, 0, limit);
            }
            if (current.count() < limit) {
                admitted.set(true);
                return current.increment();
            }
            return current;
        });

        Instant resetAt = window.windowEnd();
        Duration resetAfter = Duration.between(now, resetAt);
        if (resetAfter.isNegative()) {
            resetAfter = Duration.ZERO;
        }
        return new WindowDecision(admitted.get(), window.count(), limit, resetAfter, resetAt, false);
    }

    @Override
    public Mono<RateWindow> find(WindowKey key) {
        return Mono.justOrEmpty(windows.get(key));
    }

    @Override
    public Mono<Long> compact(Instant cutoff) {
        return Mono.fromSupplier(() -> {
            AtomicLong removed = new AtomicLong();
            windows.forEach((key, window) -> {
                if (window.windowEnd().isBefore(cutoff)
                        && windows.remove(key, window)) {
                    removed.incrementAndGet();
                }
            });
            return removed.get();
        });
    }

    int size() {
        return windows.size();
    }
}
