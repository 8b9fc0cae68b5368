package com.vcc.admission.service;

import com.vcc.admission.config.AdmissionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis cache for organization plan lookups.
 * Cache errors degrade to a miss so lookups fall through to the database.
 */
@Service
public class CacheService {
    private static final Logger log = LoggerFactory.getLogger(CacheService.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Duration planTtl;

    public CacheService(ReactiveStringRedisTemplate redisTemplate,
                        AdmissionProperties properties) {
        this.redisTemplate = redisTemplate;

        AdmissionProperties.CacheConfig cacheConfig = properties.getCache();
        if (cacheConfig != null) {
            this.keyPrefix = cacheConfig.getKeyPrefix() != null ? cacheConfig.getKeyPrefix() : "adm:";
            this.planTtl = Duration.ofSeconds(cacheConfig.getPlanTtlSeconds());
        } else {
            this.keyPrefix = "adm:";
            this.planTtl = Duration.ofMinutes(1);
        }
    }

    /**
     * Get an organization's plan from cache.
     *
     * @param organizationId Organization ID
     * @return plan code if cached, empty Mono otherwise
     */
    public Mono<String> getOrganizationPlan(String organizationId) {
        String cacheKey = planKey(organizationId);
        return redisTemplate.opsForValue().get(cacheKey)
                .doOnNext(plan -> log.debug("Cache hit for organization plan: {}", organizationId))
                .onErrorResume(e -> {
                    log.warn("Failed to read organization plan cache: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Cache an organization's plan.
     *
     * @return true if cached successfully
     */
    public Mono<Boolean> cacheOrganizationPlan(String organizationId, String plan) {
        String cacheKey = planKey(organizationId);
        return redisTemplate.opsForValue().set(cacheKey, plan, planTtl)
                .doOnSuccess(result -> log.debug("Cached organization plan: {}", organizationId))
                .onErrorResume(e -> {
                    log.warn("Failed to cache organization plan: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Invalidate an organization's cached plan.
     *
     * @return number of keys deleted
     */
    public Mono<Long> invalidateOrganizationPlan(String organizationId) {
        String cacheKey = planKey(organizationId);
        return redisTemplate.delete(cacheKey)
                .doOnSuccess(count -> log.debug("Invalidated organization plan cache: {} (deleted={})",
                        organizationId, count));
    }

    private String planKey(String organizationId) {
        return keyPrefix + "plan:" + organizationId;
    }
}
