package com.turnstile.verification.service;

import com.turnstile.common.store.CacheKeys;
import com.turnstile.common.store.CacheStore;
import com.turnstile.common.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Fail-fast per-ticket lock: {@code SET lock:<ticket_id> <ticket_id> NX EX <ttl>}.
 * The TTL bounds how long a crashed holder can block the ticket.
 */
@Service
@Slf4j
public class RedisTicketLockManager implements TicketLockManager {

    private final CacheStore cacheStore;
    private final Duration lockTtl;

    public RedisTicketLockManager(CacheStore cacheStore,
                                  @Value("${turnstile.lock.ttl-seconds:30}") long lockTtlSeconds) {
        this.cacheStore = cacheStore;
        this.lockTtl = Duration.ofSeconds(lockTtlSeconds);
    }

    @Override
    public boolean acquire(String ticketId) {
        boolean acquired = cacheStore.setIfAbsent(CacheKeys.lock(ticketId), ticketId, lockTtl);
        if (acquired) {
            log.debug("Acquired lock for ticket: {}", ticketId);
        } else {
            log.debug("Lock already held for ticket: {}", ticketId);
        }
        return acquired;
    }

    @Override
    public void release(String ticketId) {
        cacheStore.del(CacheKeys.lock(ticketId));
        log.debug("Released lock for ticket: {}", ticketId);
    }

    @Override
    public <T> T executeWithLock(String ticketId, LockedTask<T> task) {
        if (!acquire(ticketId)) {
            throw new TicketVerificationException(RejectionReason.CONCURRENT_PROCESSING);
        }

        try {
            return task.execute();
        } finally {
            releaseQuietly(ticketId);
        }
    }

    private void releaseQuietly(String ticketId) {
        try {
            release(ticketId);
        } catch (StoreUnavailableException e) {
            // The TTL clears the key; the task's own outcome must not be masked
            log.error("Failed to release lock for ticket: {}, it expires in {}s",
                    ticketId, lockTtl.getSeconds(), e);
        }
    }
}
