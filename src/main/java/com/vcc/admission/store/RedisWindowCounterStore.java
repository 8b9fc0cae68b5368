package com.vcc.admission.store;

import com.vcc.admission.model.LayerScope;
import com.vcc.admission.model.RateWindow;
import com.vcc.admission.model.WindowDecision;
import com.vcc.admission.model.WindowKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

/**
 * Window store shared by every instance through Redis. The check-and-increment runs as
 * one Lua script, so Redis serializes concurrent attempts on a key.
 *
 * <p>Each (scope, subject) owns a single hash holding the window start, count, size and
 * limit. Keys expire {@code grace} after their window ends, which stands in for the
 * background compaction the in-memory store needs.
 */
public class RedisWindowCounterStore implements WindowCounterStore {
    private static final Logger log = LoggerFactory.getLogger(RedisWindowCounterStore.class);

    private static final String FIELD_WINDOW_START = "ws";
    private static final String FIELD_COUNT = "count";
    private static final String FIELD_SIZE = "size";
    private static final String FIELD_LIMIT = "limit";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final RedisScript<String> checkAndIncrementScript;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration grace;

    public RedisWindowCounterStore(ReactiveStringRedisTemplate redisTemplate,
                                   RedisScript<String> checkAndIncrementScript,
                                   Clock clock,
                                   String keyPrefix,
                                   Duration grace) {
        this.redisTemplate = redisTemplate;
        this.checkAndIncrementScript = checkAndIncrementScript;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
        this.grace = grace;
        log.info("RedisWindowCounterStore initialized with keyPrefix={}, grace={}", keyPrefix, grace);
    }

    @Override
    public Mono<WindowDecision> checkAndIncrement(WindowKey key, long limit, Duration windowSize) {
        Instant now = clock.instant();
        Instant start = WindowCounterStore.windowStart(now, windowSize);
        long ttlMillis = windowSize.plus(grace).toMillis();

        List<String> args = List.of(
                Long.toString(start.toEpochMilli()),
                Long.toString(limit),
                Long.toString(windowSize.toMillis()),
                Long.toString(ttlMillis));

        return redisTemplate.execute(checkAndIncrementScript, List.of(redisKey(key)), args)
                .next()
                .map(result -> toDecision(result, limit, windowSize, now));
    }

    private WindowDecision toDecision(String reply, long limit, Duration windowSize, Instant now) {
        String[] parts = reply != null ? reply.split(":") : new String[0];
        if (parts.length != 3) {
            throw new StoreUnavailableException("Unexpected script reply: " + reply);
        }
        boolean allowed = "1".equals(parts[0]);
        long count;
        Instant windowStart;
        try {
            count = Long.parseLong(parts[1]);
            windowStart = Instant.ofEpochMilli(Long.parseLong(parts[2]));
        } catch (NumberFormatException e) {
            throw new StoreUnavailableException("Unexpected script reply: " + reply, e);
        }
        Instant resetAt = windowStart.plus(windowSize);
        Duration resetAfter = Duration.between(now, resetAt);
        if (resetAfter.isNegative()) {
            resetAfter = Duration.ZERO;
        }
        return new WindowDecision(allowed, count, limit, resetAfter, resetAt, false);
    }

    @Override
    public Mono<RateWindow> find(WindowKey key) {
        return redisTemplate.<String, String>opsForHash().entries(redisKey(key))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue)
                .filter(fields -> fields.containsKey(FIELD_WINDOW_START))
                .map(fields -> new RateWindow(
                        key,
                        Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_WINDOW_START))),
                        Duration.ofMillis(Long.parseLong(fields.getOrDefault(FIELD_SIZE, "0"))),
                        Long.parseLong(fields.getOrDefault(FIELD_COUNT, "0")),
                        Long.parseLong(fields.getOrDefault(FIELD_LIMIT, "0"))));
    }

    @Override
    public Mono<Long> compact(Instant cutoff) {
        // Key expiry already drops stale windows
        log.debug("Redis window store relies on key TTL, nothing to compact before {}", cutoff);
        return Mono.just(0L);
    }

    String redisKey(WindowKey key) {
        LayerScope scope = key.scope();
        return keyPrefix + "rw:" + scope.code() + ":" + key.subject();
    }
}
