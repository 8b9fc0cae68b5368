package com.vcc.admission.service;

import com.vcc.admission.config.AdmissionProperties;
import com.vcc.admission.store.WindowCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Prunes expired window rows off the request path. A window is only removed once it
 * ended more than the grace period ago, so a request stamped by a node whose clock lags
 * still finds its window.
 */
@Component
public class WindowCompactionTask {
    private static final Logger log = LoggerFactory.getLogger(WindowCompactionTask.class);

    private final WindowCounterStore store;
    private final Clock clock;
    private final Duration grace;

    public WindowCompactionTask(WindowCounterStore store, Clock clock, AdmissionProperties properties) {
        this.store = store;
        this.clock = clock;
        this.grace = Duration.ofSeconds(properties.getStore().getGraceSeconds());
    }

    @Scheduled(fixedDelayString = "${admission.store.compaction-interval-millis:60000}",
            initialDelayString = "${admission.store.compaction-interval-millis:60000}")
    public void compact() {
        Instant cutoff = cutoff();
        store.compact(cutoff)
                .subscribe(
                        removed -> {
                            if (removed > 0) {
                                log.debug("Compacted {} stale windows ended before {}", removed, cutoff);
                            }
                        },
                        e -> log.warn("Window compaction failed: {}", e.getMessage()));
    }

    Instant cutoff() {
        return clock.instant().minus(grace);
    }
}
