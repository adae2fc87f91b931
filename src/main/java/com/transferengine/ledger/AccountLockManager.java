package com.transferengine.ledger;

import com.transferengine.common.exception.ConcurrencyConflictException;
import com.transferengine.common.exception.TransactionStage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per account.
 *
 * Multi-account sections always take their locks in ascending account-id order,
 * whatever order the request named them in, so two transfers running in
 * opposite directions cannot deadlock. Locks are fair: for a single account,
 * the order in which waiters get in is the order in which they asked.
 *
 * Locks are held weakly. An entry stays while a thread holds or waits on the
 * lock and is dropped once nobody references it, so the table only tracks
 * accounts that are in use.
 */
@Component
@Slf4j
public class AccountLockManager {

    private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder()
        .weakValues()
        .build();
    private final Duration lockTimeout;

    public AccountLockManager(@Value("${transfer-engine.ledger.lock-timeout:5s}") Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    /**
     * Runs the action while holding the locks of all given accounts.
     *
     * @throws ConcurrencyConflictException if a lock is not granted within the
     *         configured timeout; the action has not started in that case
     */
    public <T> T withLocks(Collection<String> accountIds, Supplier<T> action) {
        List<String> ordered = lockOrder(accountIds);
        Deque<ReentrantLock> held = new ArrayDeque<>(ordered.size());
        try {
            for (String accountId : ordered) {
                ReentrantLock lock = locks.get(accountId, id -> new ReentrantLock(true));
                acquire(accountId, lock);
                held.push(lock);
            }
            return action.get();
        } finally {
            while (!held.isEmpty()) {
                held.pop().unlock();
            }
        }
    }

    public boolean isHeldByCurrentThread(String accountId) {
        ReentrantLock lock = locks.getIfPresent(accountId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    long trackedLocks() {
        locks.cleanUp();
        return locks.estimatedSize();
    }

    static List<String> lockOrder(Collection<String> accountIds) {
        return accountIds.stream()
            .map(id -> Objects.requireNonNull(id, "accountId"))
            .distinct()
            .sorted()
            .toList();
    }

    private void acquire(String accountId, ReentrantLock lock) {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed out after {} waiting for lock on account {}", lockTimeout, accountId);
                throw new ConcurrencyConflictException(accountId,
                    "Timed out waiting for lock on account " + accountId, TransactionStage.LOCKING);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException(accountId,
                "Interrupted while waiting for lock on account " + accountId, TransactionStage.LOCKING, e);
        }
        log.debug("Acquired lock on account {}", accountId);
    }
}
