package com.turnstile.common.model;

import com.turnstile.common.enums.EntryStatus;
import com.turnstile.common.enums.TicketStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TicketRecordTest {

    @Test
    void toHash_UsesStoredFieldNames() {
        TicketRecord ticket = TicketRecord.builder()
            .ticketId("T1")
            .eventId("E1")
            .issuer("turnstile")
            .validUntil(Instant.parse("2026-12-31T23:00:00Z"))
            .status(TicketStatus.VALID)
            .entryStatus(EntryStatus.IN)
            .entryCount(1)
            .deviceId("DEV-1")
            .scanned(Instant.parse("2026-10-19T18:00:00Z"))
            .build();

        Map<String, String> hash = ticket.toHash();

        assertEquals("T1", hash.get("ticket_id"));
        assertEquals("valid", hash.get("status"));
        assertEquals("in", hash.get("entry_status"));
        assertEquals("1", hash.get("entry_count"));
        assertEquals("DEV-1", hash.get("device_id"));
        assertEquals("2026-10-19T18:00:00Z", hash.get("scanned"));
    }

    @Test
    void toHash_SkipsAbsentOptionalFields() {
        TicketRecord ticket = TicketRecord.builder()
            .ticketId("T1").eventId("E1")
            .status(TicketStatus.VALID).entryStatus(EntryStatus.OUT).entryCount(1)
            .build();

        Map<String, String> hash = ticket.toHash();

        assertFalse(hash.containsKey("device_id"));
        assertFalse(hash.containsKey("scanned"));
    }

    @Test
    void fromHash_ParsesStoredRecord() {
        TicketRecord ticket = TicketRecord.fromHash(Map.of(
            "ticket_id", "T1",
            "event_id", "E1",
            "status", "VALID",
            "entry_status", "out",
            "entry_count", " 2 ",
            "scanned", "2026-10-19T18:00:00Z"));

        assertEquals(TicketStatus.VALID, ticket.getStatus());
        assertEquals(EntryStatus.OUT, ticket.getEntryStatus());
        assertEquals(2, ticket.getEntryCount());
        assertEquals(Instant.parse("2026-10-19T18:00:00Z"), ticket.getScanned());
        assertNull(ticket.getDeviceId());
    }

    @Test
    void fromHash_MissingStatus_Throws() {
        Map<String, String> hash = new HashMap<>();
        hash.put("ticket_id", "T1");
        hash.put("entry_status", "in");
        hash.put("entry_count", "1");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> TicketRecord.fromHash(hash));
        assertTrue(ex.getMessage().contains("status"));
    }

    @Test
    void fromHash_NonNumericEntryCount_Throws() {
        assertThrows(IllegalArgumentException.class, () -> TicketRecord.fromHash(Map.of(
            "ticket_id", "T1", "status", "valid", "entry_status", "in", "entry_count", "many")));
    }

    @Test
    void fromHash_UnknownEntryStatus_Throws() {
        assertThrows(IllegalArgumentException.class, () -> TicketRecord.fromHash(Map.of(
            "ticket_id", "T1", "status", "valid", "entry_status", "sideways", "entry_count", "1")));
    }
}
