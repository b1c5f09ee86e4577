package com.approvalgate.infrastructure.confirmation;

import com.approvalgate.domain.model.PendingConfirmation;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process confirmation store for single-instance deployments and local runs.
 *
 * <p>Each entry carries its own TTL through a Caffeine {@link Expiry}. Entries are
 * not shared between instances and do not survive a restart.
 */
@Slf4j
public class CaffeineConfirmationStore implements ConfirmationStore {

    private final Cache<String, Staged> cache;

    public CaffeineConfirmationStore(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public CaffeineConfirmationStore(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new StagedExpiry())
            .ticker(ticker)
            .recordStats()
            .build();
        log.info("Configured in-memory confirmation store: maximumSize={}", maximumSize);
    }

    @Override
    public void put(PendingConfirmation confirmation, Duration ttl) {
        cache.put(confirmation.getConfirmationId(), new Staged(confirmation, ttl));
    }

    @Override
    public Optional<PendingConfirmation> get(String confirmationId) {
        return Optional.ofNullable(cache.getIfPresent(confirmationId)).map(Staged::confirmation);
    }

    @Override
    public Optional<PendingConfirmation> take(String confirmationId) {
        // asMap().remove is atomic and yields null for an entry past its TTL
        return Optional.ofNullable(cache.asMap().remove(confirmationId)).map(Staged::confirmation);
    }

    @Override
    public void remove(String confirmationId) {
        cache.invalidate(confirmationId);
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static final class Staged {
        private final PendingConfirmation confirmation;
        private final Duration ttl;

        private Staged(PendingConfirmation confirmation, Duration ttl) {
            this.confirmation = confirmation;
            this.ttl = ttl;
        }

        private PendingConfirmation confirmation() {
            return confirmation;
        }
    }

    private static final class StagedExpiry implements Expiry<String, Staged> {

        @Override
        public long expireAfterCreate(String key, Staged value, long currentTime) {
            return value.ttl.toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Staged value, long currentTime, long currentDuration) {
            return value.ttl.toNanos();
        }

        @Override
        public long expireAfterRead(String key, Staged value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
