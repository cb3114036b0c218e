package com.turnstile.common.service;

import com.turnstile.common.model.CurrentEvent;
import com.turnstile.common.store.CacheKeys;
import com.turnstile.common.store.CacheStore;
import com.turnstile.common.store.StoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CurrentEventRegistryTest {

    @Mock
    private CacheStore cacheStore;

    @InjectMocks
    private CurrentEventRegistry registry;

    @Test
    void current_StoredEvent_ReturnsIt() {
        when(cacheStore.hGetAll(CacheKeys.CURRENT_EVENT)).thenReturn(Map.of(
            "id", "E1", "name", "Concert", "max_capacity", "100", "max_entries", "2", "validity", "2026-12-31"));

        Optional<CurrentEvent> event = registry.current();

        assertTrue(event.isPresent());
        assertEquals("E1", event.get().getId());
        assertEquals(100L, event.get().getMaxCapacity());
        assertEquals(2, event.get().getMaxEntries());
    }

    @Test
    void current_NoEvent_ReturnsEmpty() {
        when(cacheStore.hGetAll(CacheKeys.CURRENT_EVENT)).thenReturn(Collections.emptyMap());

        assertTrue(registry.current().isEmpty());
    }

    @Test
    void current_CorruptCapacity_TreatedAsNoEvent() {
        when(cacheStore.hGetAll(CacheKeys.CURRENT_EVENT)).thenReturn(Map.of(
            "id", "E1", "max_capacity", "lots", "max_entries", "1"));

        assertTrue(registry.current().isEmpty());
    }

    @Test
    void replace_WritesWholeHashInOneCall() {
        CurrentEvent event = CurrentEvent.builder()
            .id("E2").name("Match").maxCapacity(50).maxEntries(1).validity("today").build();

        registry.replace(event);

        verify(cacheStore).hReplace(CacheKeys.CURRENT_EVENT, event.toHash());
        verify(cacheStore, never()).del(anyString());
        verify(cacheStore, never()).hSet(anyString(), anyMap());
    }

    @Test
    void replace_StoreFails_PreviousEventNotDeleted() {
        CurrentEvent event = CurrentEvent.builder()
            .id("E2").name("Match").maxCapacity(50).maxEntries(1).validity("today").build();
        doThrow(new StoreUnavailableException("down", null))
            .when(cacheStore).hReplace(eq(CacheKeys.CURRENT_EVENT), anyMap());

        assertThrows(StoreUnavailableException.class, () -> registry.replace(event));

        verify(cacheStore, never()).del(anyString());
    }

    @Test
    void delete_RemovesHash() {
        registry.delete();

        verify(cacheStore).del(CacheKeys.CURRENT_EVENT);
    }
}
