package com.approvalgate.config;

import com.approvalgate.infrastructure.confirmation.CaffeineConfirmationStore;
import com.approvalgate.infrastructure.confirmation.ConfirmationStore;
import com.approvalgate.infrastructure.confirmation.RedisConfirmationStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the confirmation store backend.
 *
 * <p>Redis is the default: the proposing and the executing request may land on
 * different instances, so the store must be shared. The Caffeine store exists
 * for single-node deployments and local development only.
 */
@Configuration
@Slf4j
public class ConfirmationStoreConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "approval-gate.confirmation", name = "store", havingValue = "redis", matchIfMissing = true)
    public ConfirmationStore redisConfirmationStore(StringRedisTemplate redis,
                                                    ObjectMapper objectMapper,
                                                    ConfirmationProperties properties) {
        log.info("Configuring Redis confirmation store: keyPrefix={}, ttl={}s",
            properties.getKeyPrefix(), properties.getTtl().toSeconds());
        return new RedisConfirmationStore(redis, objectMapper, properties.getKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(prefix = "approval-gate.confirmation", name = "store", havingValue = "memory")
    public ConfirmationStore caffeineConfirmationStore(ConfirmationProperties properties) {
        log.warn("Configuring in-memory confirmation store; confirmations are not shared across instances");
        return new CaffeineConfirmationStore(properties.getMemoryMaxEntries());
    }
}
