package com.turnstile.event.service;

import com.turnstile.common.store.CacheKeys;
import com.turnstile.common.store.CacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Maintains blacklist and revocation membership. Presence of the key is what denies entry;
 * the stored value is only the reason, for operators.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TicketExclusionService {

    public enum ExclusionList {
        BLACKLIST,
        REVOKED
    }

    private final CacheStore cacheStore;

    /**
     * Add a ticket to a list
     *
     * @param ttl Optional expiry; null keeps the entry until removed
     */
    public void exclude(ExclusionList list, String ticketId, String reason, Duration ttl) {
        String key = keyFor(list, ticketId);
        String value = reason == null || reason.isBlank() ? "true" : reason;

        if (ttl != null) {
            cacheStore.set(key, value, ttl);
        } else {
            cacheStore.set(key, value);
        }
        log.info("Ticket {} added to {}: {}", ticketId, list, value);
    }

    public void include(ExclusionList list, String ticketId) {
        cacheStore.del(keyFor(list, ticketId));
        log.info("Ticket {} removed from {}", ticketId, list);
    }

    public boolean isExcluded(ExclusionList list, String ticketId) {
        return cacheStore.exists(keyFor(list, ticketId));
    }

    private static String keyFor(ExclusionList list, String ticketId) {
        return list == ExclusionList.BLACKLIST ? CacheKeys.blacklist(ticketId) : CacheKeys.revoked(ticketId);
    }
}
