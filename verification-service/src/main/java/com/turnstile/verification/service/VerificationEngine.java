package com.turnstile.verification.service;

import com.turnstile.common.enums.EntryStatus;
import com.turnstile.common.enums.TicketStatus;
import com.turnstile.common.model.CurrentEvent;
import com.turnstile.common.model.TicketRecord;
import com.turnstile.common.service.CurrentEventRegistry;
import com.turnstile.common.store.CacheKeys;
import com.turnstile.common.store.CacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Decides whether a scanned ticket may pass the gate.
 *
 * Checks run in a fixed order and the first failure ends the attempt:
 * current event, token signature, issuer, ticket validity, event match,
 * blacklist, revocation, per-ticket lock, capacity, and finally the ticket's
 * own entry record. Only an admission writes to the ledger.
 */
@Service
@Slf4j
public class VerificationEngine {

    private final CurrentEventRegistry eventRegistry;
    private final TicketTokenValidator tokenValidator;
    private final TicketLockManager lockManager;
    private final TicketLedger ledger;
    private final CacheStore cacheStore;
    private final Clock clock;
    private final String tokenSecret;
    private final String issuer;

    public VerificationEngine(CurrentEventRegistry eventRegistry,
                              TicketTokenValidator tokenValidator,
                              TicketLockManager lockManager,
                              TicketLedger ledger,
                              CacheStore cacheStore,
                              Clock clock,
                              @Value("${turnstile.token.secret}") String tokenSecret,
                              @Value("${turnstile.token.issuer:turnstile}") String issuer) {
        this.eventRegistry = eventRegistry;
        this.tokenValidator = tokenValidator;
        this.lockManager = lockManager;
        this.ledger = ledger;
        this.cacheStore = cacheStore;
        this.clock = clock;
        this.tokenSecret = tokenSecret;
        this.issuer = issuer;
    }

    /**
     * Verify a scanned ticket and admit its holder.
     *
     * @param token The signed token read from the QR code
     * @param deviceKey Serial number of the scanning device
     * @param scanTime When the device scanned the code
     * @return The ticket's entry record after admission
     * @throws TicketVerificationException if the ticket must not pass
     * @throws com.turnstile.common.store.StoreUnavailableException if the store failed mid-attempt
     */
    public TicketRecord verify(String token, String deviceKey, Instant scanTime) {
        String ticketId = null;
        try {
            CurrentEvent event = eventRegistry.current()
                .orElseThrow(() -> new TicketVerificationException(RejectionReason.NO_ACTIVE_EVENT));

            TicketClaims claims = tokenValidator.verify(token, tokenSecret);
            ticketId = claims.getTicketId();

            validateIssuer(claims);
            checkTicketExpiry(claims);
            validateEventId(claims, event);

            checkBlacklisted(ticketId);
            checkRevoked(ticketId);

            TicketRecord admitted = lockManager.executeWithLock(ticketId,
                () -> admit(claims, event, deviceKey, scanTime));

            log.info("Ticket admitted: ticket={} device={} entryCount={}",
                    admitted.getTicketId(), deviceKey, admitted.getEntryCount());
            return admitted;

        } catch (TicketVerificationException e) {
            log.warn("Ticket validation failed: reason={} ticket={} device={} - {}",
                    e.getReason(), ticketId, deviceKey, e.getMessage());
            throw e;
        }
    }

    private void validateIssuer(TicketClaims claims) {
        if (!issuer.equals(claims.getIssuer())) {
            throw new TicketVerificationException(RejectionReason.ISSUER_MISMATCH,
                "Ticket was not issued by " + issuer);
        }
    }

    private void checkTicketExpiry(TicketClaims claims) {
        if (!claims.getValidUntil().isAfter(clock.instant())) {
            throw new TicketVerificationException(RejectionReason.TICKET_EXPIRED);
        }
    }

    private void validateEventId(TicketClaims claims, CurrentEvent event) {
        if (!event.getId().equals(claims.getEventId())) {
            throw new TicketVerificationException(RejectionReason.EVENT_MISMATCH);
        }
    }

    private void checkBlacklisted(String ticketId) {
        if (cacheStore.exists(CacheKeys.blacklist(ticketId))) {
            throw new TicketVerificationException(RejectionReason.BLACKLISTED);
        }
    }

    private void checkRevoked(String ticketId) {
        if (cacheStore.exists(CacheKeys.revoked(ticketId))) {
            throw new TicketVerificationException(RejectionReason.REVOKED);
        }
    }

    /**
     * Runs under the ticket lock.
     */
    private TicketRecord admit(TicketClaims claims, CurrentEvent event, String deviceKey, Instant scanTime) {
        if (ledger.currentAttendees() >= event.getMaxCapacity()) {
            throw new TicketVerificationException(RejectionReason.EVENT_FULL);
        }

        Optional<TicketRecord> existing = readTicket(claims.getTicketId());

        if (existing.isEmpty()) {
            TicketRecord firstEntry = TicketRecord.builder()
                .ticketId(claims.getTicketId())
                .eventId(claims.getEventId())
                .issuer(claims.getIssuer())
                .validUntil(claims.getValidUntil())
                .status(TicketStatus.VALID)
                .entryStatus(EntryStatus.IN)
                .entryCount(1)
                .deviceId(deviceKey)
                .scanned(scanTime)
                .build();
            return commitEntry(firstEntry, event);
        }

        TicketRecord ticket = existing.get();
        if (!ticket.getStatus().isAdmissible()) {
            throw new TicketVerificationException(RejectionReason.TICKET_INVALID_OR_REVOKED);
        }
        if (ticket.getEntryStatus().isInside()) {
            throw new TicketVerificationException(RejectionReason.ALREADY_INSIDE);
        }
        if (ticket.getEntryCount() >= event.getMaxEntries()) {
            throw new TicketVerificationException(RejectionReason.MAX_ENTRIES_REACHED);
        }

        TicketRecord reentry = ticket.toBuilder()
            .entryStatus(EntryStatus.IN)
            .entryCount(ticket.getEntryCount() + 1)
            .build();
        return commitEntry(reentry, event);
    }

    private Optional<TicketRecord> readTicket(String ticketId) {
        try {
            return ledger.read(ticketId);
        } catch (IllegalArgumentException e) {
            log.error("Unreadable ticket record: ticket={}", ticketId, e);
            throw new TicketVerificationException(RejectionReason.TICKET_INVALID_OR_REVOKED,
                RejectionReason.TICKET_INVALID_OR_REVOKED.getDefaultMessage(), e);
        }
    }

    /**
     * Take an attendee slot atomically, then persist the record. A failed save gives the slot back.
     */
    private TicketRecord commitEntry(TicketRecord ticket, CurrentEvent event) {
        OptionalLong attendees = ledger.incrementAttendeesWithin(event.getMaxCapacity());
        if (attendees.isEmpty()) {
            throw new TicketVerificationException(RejectionReason.EVENT_FULL);
        }

        try {
            ledger.write(ticket);
        } catch (RuntimeException e) {
            log.error("Failed to save admission for ticket: {}, releasing attendee slot", ticket.getTicketId(), e);
            try {
                ledger.releaseAttendee();
            } catch (RuntimeException releaseFailure) {
                log.error("Failed to release attendee slot for ticket: {}", ticket.getTicketId(), releaseFailure);
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }

        log.info("Admission committed: ticket={} attendees={}/{}",
                ticket.getTicketId(), attendees.getAsLong(), event.getMaxCapacity());
        return ticket;
    }
}
