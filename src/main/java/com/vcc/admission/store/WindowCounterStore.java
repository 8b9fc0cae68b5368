package com.vcc.admission.store;

import com.vcc.admission.model.RateWindow;
import com.vcc.admission.model.WindowDecision;
import com.vcc.admission.model.WindowKey;
import java.time.Duration;
import java.time.Instant;
import reactor.core.publisher.Mono;

/**
 * Atomic fixed-window counters keyed by (scope, subject).
 *
 * <p>Fixed windows, not a sliding log: a counter covers one aligned interval of
 * {@code windowSize} and is logically reset to zero by the same atomic operation that
 * performs the check once the clock crosses into the next interval. Storage is O(1) per
 * subject and each check is a single round trip, at the cost of admitting up to roughly
 * twice the limit for traffic that straddles a window boundary (a full quota at the end
 * of one window followed by a full quota at the start of the next).
 *
 * <p>Implementations must perform the compare and the increment as one atomic step:
 * concurrent callers racing on the same key never both see "below limit" when only one
 * slot is left, so the count never exceeds the limit.
 */
public interface WindowCounterStore {

    /**
     * Count one attempt if the current window still has room.
     *
     * @return decision carrying the post-operation count; a rejected attempt does not
     *         change the count
     */
    Mono<WindowDecision> checkAndIncrement(WindowKey key, long limit, Duration windowSize);

    /**
     * Current window row for the key, empty if none exists.
     */
    Mono<RateWindow> find(WindowKey key);

    /**
     * Remove windows that ended before {@code cutoff}.
     *
     * @return number of rows removed
     */
    Mono<Long> compact(Instant cutoff);

    /**
     * Start of the aligned window containing {@code now}.
     */
    static Instant windowStart(Instant now, Duration windowSize) {
        long sizeMillis = windowSize.toMillis();
        if (sizeMillis <= 0) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        long epochMillis = now.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(epochMillis, sizeMillis) * sizeMillis);
    }
}
