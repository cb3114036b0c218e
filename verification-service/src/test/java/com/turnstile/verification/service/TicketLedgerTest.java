package com.turnstile.verification.service;

import com.turnstile.common.enums.EntryStatus;
import com.turnstile.common.enums.TicketStatus;
import com.turnstile.common.model.TicketRecord;
import com.turnstile.common.store.CacheStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TicketLedgerTest {

    @Mock
    private CacheStore cacheStore;

    @InjectMocks
    private TicketLedger ledger;

    @Test
    void read_NoRecord_ReturnsEmpty() {
        when(cacheStore.hGetAll("ticket:T1")).thenReturn(Collections.emptyMap());

        assertTrue(ledger.read("T1").isEmpty());
    }

    @Test
    void read_StoredRecord_Parsed() {
        when(cacheStore.hGetAll("ticket:T1")).thenReturn(Map.of(
            "ticket_id", "T1", "status", "valid", "entry_status", "out", "entry_count", "1"));

        TicketRecord ticket = ledger.read("T1").orElseThrow();

        assertEquals(EntryStatus.OUT, ticket.getEntryStatus());
        assertEquals(1, ticket.getEntryCount());
    }

    @Test
    void read_CorruptRecord_Throws() {
        when(cacheStore.hGetAll("ticket:T1")).thenReturn(Map.of("ticket_id", "T1", "status", "???"));

        assertThrows(IllegalArgumentException.class, () -> ledger.read("T1"));
    }

    @Test
    void write_StoresHashUnderTicketKey() {
        TicketRecord ticket = TicketRecord.builder()
            .ticketId("T1").eventId("E1")
            .status(TicketStatus.VALID).entryStatus(EntryStatus.IN).entryCount(1)
            .build();

        ledger.write(ticket);

        verify(cacheStore).hSet("ticket:T1", ticket.toHash());
    }

    @Test
    void currentAttendees_MissingCounter_IsZero() {
        when(cacheStore.get("current_attendees_count")).thenReturn(Optional.empty());

        assertEquals(0L, ledger.currentAttendees());
    }

    @Test
    void currentAttendees_ParsesCounter() {
        when(cacheStore.get("current_attendees_count")).thenReturn(Optional.of("42"));

        assertEquals(42L, ledger.currentAttendees());
    }

    @Test
    void currentAttendees_NonNumeric_ThrowsIllegalState() {
        when(cacheStore.get("current_attendees_count")).thenReturn(Optional.of("forty"));

        assertThrows(IllegalStateException.class, () -> ledger.currentAttendees());
    }

    @Test
    void incrementAttendeesWithin_DelegatesToBoundedIncrement() {
        when(cacheStore.incrementIfBelow("current_attendees_count", 100)).thenReturn(OptionalLong.of(1));

        assertEquals(OptionalLong.of(1), ledger.incrementAttendeesWithin(100));
    }

    @Test
    void releaseAttendee_DecrementsCounter() {
        when(cacheStore.decrementIfPositive("current_attendees_count")).thenReturn(0L);

        ledger.releaseAttendee();

        verify(cacheStore).decrementIfPositive("current_attendees_count");
    }
}
