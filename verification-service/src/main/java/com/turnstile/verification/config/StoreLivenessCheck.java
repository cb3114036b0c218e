package com.turnstile.verification.config;

import com.turnstile.common.store.CacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Reports at startup whether the shared store answers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StoreLivenessCheck {

    private final CacheStore cacheStore;

    @EventListener(ApplicationReadyEvent.class)
    public void reportStoreStatus() {
        if (cacheStore.ping()) {
            log.info("Redis server reachable");
        } else {
            log.error("Redis server not reachable, verifications will fail until it is");
        }
    }
}
