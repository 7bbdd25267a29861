package com.flagship.margin_ledger.ledger;

import com.flagship.margin_ledger.common.LockAcquisitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AccountLockManagerTest {

    @Test
    @DisplayName("Lock held by another thread times out with a retryable error")
    void timesOutWhenHeldElsewhere() throws Exception {
        AccountLockManager lockManager = new AccountLockManager(50);
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> holder = CompletableFuture.runAsync(() ->
            lockManager.withLock("account:A", () -> {
                acquired.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));

        assertTrue(acquired.await(5, TimeUnit.SECONDS));
        LockAcquisitionException e = assertThrows(LockAcquisitionException.class,
            () -> lockManager.withLock("account:A", () -> "never"));
        assertEquals("RETRYABLE", e.getCode());

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertEquals("ok", lockManager.withLock("account:A", () -> "ok"));
        assertEquals(0, lockManager.size());
    }

    @Test
    @DisplayName("A key's entry is dropped once nobody holds or waits for it")
    void idleKeysAreDropped() {
        AccountLockManager lockManager = new AccountLockManager(50);

        lockManager.withLocks(List.of("account:A", "account:B"), () -> {
            assertEquals(2, lockManager.size());
            return lockManager.withLock("account:A", () -> {
                assertEquals(2, lockManager.size());
                return null;
            });
        });
        for (int i = 0; i < 1000; i++) {
            lockManager.withLock("idem:t1:key-" + i, () -> null);
        }

        assertEquals(0, lockManager.size());
    }

    @Test
    @DisplayName("Contended keys stay mutually exclusive while entries come and go")
    void exclusiveUnderChurn() throws Exception {
        AccountLockManager lockManager = new AccountLockManager(5000);
        int threads = 8;
        int rounds = 2000;
        int[] counter = new int[1];
        AtomicInteger inside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<Void>> workers = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            workers.add(executor.submit(() -> {
                for (int i = 0; i < rounds; i++) {
                    lockManager.withLock("account:A", () -> {
                        assertEquals(1, inside.incrementAndGet());
                        counter[0]++;
                        inside.decrementAndGet();
                        return null;
                    });
                }
                return null;
            }));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        for (Future<Void> worker : workers) {
            worker.get();
        }

        assertEquals(threads * rounds, counter[0]);
        assertEquals(0, lockManager.size());
    }

    @Test
    @DisplayName("Locks are reentrant for the owning thread")
    void reentrant() {
        AccountLockManager lockManager = new AccountLockManager(50);

        String result = lockManager.withLocks(List.of("margin:M", "account:A"),
            () -> lockManager.withLock("account:A", () -> "nested"));

        assertEquals("nested", result);
    }

    @Test
    @DisplayName("Opposite request orders do not deadlock")
    void noDeadlockOnOppositeOrder() throws Exception {
        AccountLockManager lockManager = new AccountLockManager(2000);
        int rounds = 500;

        CompletableFuture<Void> forward = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < rounds; i++) {
                lockManager.withLocks(List.of("account:A", "account:B"), () -> null);
            }
        });
        CompletableFuture<Void> backward = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < rounds; i++) {
                lockManager.withLocks(List.of("account:B", "account:A"), () -> null);
            }
        });

        forward.get(10, TimeUnit.SECONDS);
        backward.get(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Lock keys are namespaced by kind")
    void keyFormats() {
        assertEquals("account:A", AccountLockManager.accountKey("A"));
        assertEquals("idem:t1:k1", AccountLockManager.idempotencyKey("t1", "k1"));
        assertEquals("margin:M", AccountLockManager.marginKey("M"));
    }
}
