package com.approvalgate.infrastructure.confirmation;

import com.approvalgate.domain.model.PendingConfirmation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed confirmation store, shared by every service instance.
 *
 * <p>Confirmations are stored as JSON strings under {@code <prefix><id>} with a
 * native Redis TTL. {@link #take} uses {@code GETDEL} so consumption is atomic
 * on the server.
 */
@Slf4j
public class RedisConfirmationStore implements ConfirmationStore {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisConfirmationStore(StringRedisTemplate redis, ObjectMapper objectMapper, String keyPrefix) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void put(PendingConfirmation confirmation, Duration ttl) {
        String key = key(confirmation.getConfirmationId());
        try {
            String json = objectMapper.writeValueAsString(confirmation);
            redis.opsForValue().set(key, json, ttl);
            log.debug("Stored pending confirmation: key={}, ttl={}s", key, ttl.toSeconds());
        } catch (JsonProcessingException e) {
            throw new ConfirmationStoreException("Failed to serialize pending confirmation", e);
        } catch (DataAccessException e) {
            throw new ConfirmationStoreException("Failed to store pending confirmation", e);
        }
    }

    @Override
    public Optional<PendingConfirmation> get(String confirmationId) {
        try {
            return deserialize(redis.opsForValue().get(key(confirmationId)));
        } catch (DataAccessException e) {
            throw new ConfirmationStoreException("Failed to read pending confirmation", e);
        }
    }

    @Override
    public Optional<PendingConfirmation> take(String confirmationId) {
        try {
            return deserialize(redis.opsForValue().getAndDelete(key(confirmationId)));
        } catch (DataAccessException e) {
            throw new ConfirmationStoreException("Failed to consume pending confirmation", e);
        }
    }

    @Override
    public void remove(String confirmationId) {
        try {
            redis.delete(key(confirmationId));
        } catch (DataAccessException e) {
            throw new ConfirmationStoreException("Failed to remove pending confirmation", e);
        }
    }

    private Optional<PendingConfirmation> deserialize(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, PendingConfirmation.class));
        } catch (JsonProcessingException e) {
            throw new ConfirmationStoreException("Stored pending confirmation is unreadable", e);
        }
    }

    private String key(String confirmationId) {
        return keyPrefix + confirmationId;
    }
}
