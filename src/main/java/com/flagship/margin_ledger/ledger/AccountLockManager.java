package com.flagship.margin_ledger.ledger;

import com.flagship.margin_ledger.common.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key critical sections for the ledger and margin components.
 *
 * Keys are plain strings ({@code account:{id}}, {@code idem:{tenant}:{key}},
 * {@code margin:{accountId}}). A multi-key acquisition always takes the keys in
 * natural string order and releases them in reverse, so two callers touching
 * overlapping key sets cannot deadlock. Each attempt waits at most the configured
 * time; on timeout everything already taken is released and
 * {@link LockAcquisitionException} is thrown.
 *
 * A key's entry lives only while some thread holds or waits for it.
 */
@Component
@Slf4j
public class AccountLockManager {

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final long waitMillis;

    public AccountLockManager(@Value("${ledger.lock.wait-ms:5000}") long waitMillis) {
        this.waitMillis = waitMillis;
    }

    public static String accountKey(String accountId) {
        return "account:" + accountId;
    }

    public static String idempotencyKey(String tenantId, String key) {
        return "idem:" + tenantId + ":" + key;
    }

    public static String marginKey(String marginAccountId) {
        return "margin:" + marginAccountId;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        return withLocks(List.of(key), action);
    }

    /**
     * Runs {@code action} while holding every lock in {@code keys}.
     *
     * @throws LockAcquisitionException if any lock cannot be taken within the wait
     */
    public <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        Deque<String> held = new ArrayDeque<>();
        try {
            for (String key : new TreeSet<>(keys)) {
                KeyLock keyLock = retain(key);
                boolean acquired = false;
                try {
                    acquired = tryAcquire(keyLock.lock);
                } finally {
                    if (!acquired) {
                        release(key);
                    }
                }
                if (!acquired) {
                    log.warn("Lock wait of {}ms exceeded for key {}", waitMillis, key);
                    throw new LockAcquisitionException("Could not acquire lock for " + key + ", retry later");
                }
                held.push(key);
            }
            return action.get();
        } finally {
            while (!held.isEmpty()) {
                String key = held.pop();
                locks.get(key).lock.unlock();
                release(key);
            }
        }
    }

    /**
     * Number of keys currently held or waited for.
     */
    int size() {
        return locks.size();
    }

    private KeyLock retain(String key) {
        return locks.compute(key, (k, existing) -> {
            KeyLock keyLock = existing == null ? new KeyLock() : existing;
            keyLock.users++;
            return keyLock;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, keyLock) -> --keyLock.users == 0 ? null : keyLock);
    }

    private boolean tryAcquire(ReentrantLock lock) {
        try {
            return lock.tryLock(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for lock", e);
        }
    }

    // users is only read and written inside compute calls on its key
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
