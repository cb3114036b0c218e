package com.turnstile.common.service;

import com.turnstile.common.model.CurrentEvent;
import com.turnstile.common.store.CacheKeys;
import com.turnstile.common.store.CacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the single active event held in the {@code current_event} hash.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CurrentEventRegistry {

    private final CacheStore cacheStore;

    /**
     * Get the active event. A missing or unreadable record counts as no event.
     */
    public Optional<CurrentEvent> current() {
        Map<String, String> hash = cacheStore.hGetAll(CacheKeys.CURRENT_EVENT);
        if (hash.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.of(CurrentEvent.fromHash(hash));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unreadable current event record: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replace the active event wholesale in one store call, so no stale field survives
     * and a failed write keeps the previous event.
     */
    public void replace(CurrentEvent event) {
        cacheStore.hReplace(CacheKeys.CURRENT_EVENT, event.toHash());
        log.info("Current event set: id={} name={} capacity={} maxEntries={}",
                event.getId(), event.getName(), event.getMaxCapacity(), event.getMaxEntries());
    }

    public void delete() {
        cacheStore.del(CacheKeys.CURRENT_EVENT);
        log.info("Current event deleted");
    }
}
