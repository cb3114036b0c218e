package com.turnstile.verification.service;

import com.turnstile.common.model.TicketRecord;
import com.turnstile.common.store.CacheKeys;
import com.turnstile.common.store.CacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Per-ticket entry records and the global attendee counter.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TicketLedger {

    private final CacheStore cacheStore;

    /**
     * @throws IllegalArgumentException if the stored record is malformed
     */
    public Optional<TicketRecord> read(String ticketId) {
        Map<String, String> hash = cacheStore.hGetAll(CacheKeys.ticket(ticketId));
        if (hash.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(TicketRecord.fromHash(hash));
    }

    public void write(TicketRecord ticket) {
        cacheStore.hSet(CacheKeys.ticket(ticket.getTicketId()), ticket.toHash());
        log.debug("Saved ticket record: {} entryStatus={} entryCount={}",
                ticket.getTicketId(), ticket.getEntryStatus(), ticket.getEntryCount());
    }

    public long currentAttendees() {
        Optional<String> raw = cacheStore.get(CacheKeys.CURRENT_ATTENDEES_COUNT);
        if (raw.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(raw.get().trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Attendee counter is not a number: " + raw.get(), e);
        }
    }

    /**
     * Take one attendee slot if the counter is still below capacity.
     *
     * @return The new attendee count, or empty if the event is full
     */
    public OptionalLong incrementAttendeesWithin(long capacity) {
        return cacheStore.incrementIfBelow(CacheKeys.CURRENT_ATTENDEES_COUNT, capacity);
    }

    /**
     * Give back a slot taken by {@link #incrementAttendeesWithin(long)} when the admission could not be saved.
     */
    public void releaseAttendee() {
        long remaining = cacheStore.decrementIfPositive(CacheKeys.CURRENT_ATTENDEES_COUNT);
        log.debug("Released attendee slot, count now {}", remaining);
    }
}
