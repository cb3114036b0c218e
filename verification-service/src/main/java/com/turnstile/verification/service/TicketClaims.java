package com.turnstile.verification.service;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Verified payload of a ticket token.
 */
@Value
@Builder
public class TicketClaims {

    String ticketId;
    String eventId;
    String issuer;
    Instant validUntil;

    // Standard JWT timestamps, absent when the issuer left them out
    Instant issuedAt;
    Instant expiresAt;
}
