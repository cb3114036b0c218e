package com.turnstile.event.service;

import com.turnstile.common.store.CacheStore;
import com.turnstile.event.service.TicketExclusionService.ExclusionList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TicketExclusionServiceTest {

    @Mock
    private CacheStore cacheStore;

    @InjectMocks
    private TicketExclusionService exclusionService;

    @Test
    void exclude_Blacklist_WithReasonAndTtl() {
        exclusionService.exclude(ExclusionList.BLACKLIST, "T1", "fraud", Duration.ofHours(1));

        verify(cacheStore).set("blacklist:T1", "fraud", Duration.ofHours(1));
    }

    @Test
    void exclude_Revoked_NoReasonNoTtl_StoresFlag() {
        exclusionService.exclude(ExclusionList.REVOKED, "T1", null, null);

        verify(cacheStore).set("revoked:T1", "true");
        verify(cacheStore, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void include_DeletesKey() {
        exclusionService.include(ExclusionList.REVOKED, "T1");

        verify(cacheStore).del("revoked:T1");
    }

    @Test
    void isExcluded_ChecksKeyPresence() {
        when(cacheStore.exists("blacklist:T1")).thenReturn(true);
        when(cacheStore.exists("revoked:T1")).thenReturn(false);

        assertTrue(exclusionService.isExcluded(ExclusionList.BLACKLIST, "T1"));
        assertFalse(exclusionService.isExcluded(ExclusionList.REVOKED, "T1"));
    }
}
