package com.flagship.margin_ledger.ledger;

import com.flagship.margin_ledger.ledger.store.JournalEntryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency key lookups for journal entries.
 *
 * Strategy:
 * 1. Try Redis first when enabled (fast, but can be unavailable)
 * 2. Fall back to the journal entry store (the source of truth)
 * 3. Cache store hits in Redis for later lookups
 *
 * The ledger repeats the store lookup inside its critical section, so a stale or
 * missing Redis value can never produce a double posting.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final JournalEntryStore journalEntryStore;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(JournalEntryStore journalEntryStore,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${ledger.idempotency.redis-enabled:false}") boolean redisEnabled) {
        this.journalEntryStore = journalEntryStore;
        this.redisTemplate = redisEnabled ? redisTemplate : Optional.empty();
    }

    /**
     * Finds the entry previously posted under {@code (tenantId, idempotencyKey)}.
     */
    public Optional<JournalEntry> findExisting(String tenantId, String idempotencyKey) {
        String redisKey = redisKey(tenantId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String entryId = redisTemplate.get().opsForValue().get(redisKey);
                if (entryId != null) {
                    Optional<JournalEntry> cached = journalEntryStore.findById(UUID.fromString(entryId));
                    if (cached.isPresent()) {
                        log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                        return cached;
                    }
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to store. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<JournalEntry> existing = journalEntryStore.findByIdempotencyKey(tenantId, idempotencyKey);
        existing.ifPresent(entry -> remember(tenantId, idempotencyKey, entry.getId()));
        return existing;
    }

    /**
     * Caches the key in Redis. Best effort: the store already holds the key with the entry.
     */
    public void remember(String tenantId, String idempotencyKey, UUID entryId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(tenantId, idempotencyKey), entryId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to store idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private static String redisKey(String tenantId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + tenantId + ":" + idempotencyKey;
    }
}
