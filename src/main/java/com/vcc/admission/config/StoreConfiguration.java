package com.vcc.admission.config;

import com.vcc.admission.store.InMemoryWindowCounterStore;
import com.vcc.admission.store.RedisWindowCounterStore;
import com.vcc.admission.store.WindowCounterStore;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Picks the window counter backing from {@code admission.store.type}.
 */
@Configuration
public class StoreConfiguration {

    @Bean
    public Clock admissionClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RedisScript<String> checkAndIncrementScript() {
        return RedisScript.of(new ClassPathResource("scripts/check_and_increment.lua"), String.class);
    }

    @Bean
    @ConditionalOnProperty(prefix = "admission.store", name = "type", havingValue = "redis", matchIfMissing = true)
    public WindowCounterStore redisWindowCounterStore(ReactiveStringRedisTemplate redisTemplate,
                                                      RedisScript<String> checkAndIncrementScript,
                                                      Clock admissionClock,
                                                      AdmissionProperties properties) {
        return new RedisWindowCounterStore(
                redisTemplate,
                checkAndIncrementScript,
                admissionClock,
                properties.getCache().getKeyPrefix(),
                Duration.ofSeconds(properties.getStore().getGraceSeconds()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "admission.store", name = "type", havingValue = "memory")
    public WindowCounterStore inMemoryWindowCounterStore(Clock admissionClock) {
        return new InMemoryWindowCounterStore(admissionClock);
    }
}
