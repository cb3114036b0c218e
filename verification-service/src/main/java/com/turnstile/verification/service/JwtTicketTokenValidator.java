package com.turnstile.verification.service;

import com.turnstile.common.util.Timestamps;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Verifies HMAC-signed JWT ticket tokens.
 *
 * Expected claims: {@code ticket_id}, {@code event_id}, {@code issuer}, {@code valid_until}.
 * The standard {@code exp} claim, when present, is enforced against the injected clock.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JwtTicketTokenValidator implements TicketTokenValidator {

    static final String CLAIM_TICKET_ID = "ticket_id";
    static final String CLAIM_EVENT_ID = "event_id";
    static final String CLAIM_ISSUER = "issuer";
    static final String CLAIM_VALID_UNTIL = "valid_until";

    private final Clock clock;

    @Override
    public TicketClaims verify(String token, String secret) {
        Claims claims;
        try {
            SecretKey key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
            claims = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired token: {}", e.getMessage());
            throw new TicketVerificationException(RejectionReason.TOKEN_EXPIRED,
                RejectionReason.TOKEN_EXPIRED.getDefaultMessage(), e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected invalid token: {}", e.getMessage());
            throw new TicketVerificationException(RejectionReason.TOKEN_INVALID,
                RejectionReason.TOKEN_INVALID.getDefaultMessage(), e);
        }

        return toTicketClaims(claims);
    }

    private TicketClaims toTicketClaims(Claims claims) {
        Instant validUntil;
        try {
            validUntil = Timestamps.fromClaim(requiredClaim(claims, CLAIM_VALID_UNTIL));
        } catch (IllegalArgumentException e) {
            throw new TicketVerificationException(RejectionReason.TOKEN_INVALID,
                "Invalid token: malformed " + CLAIM_VALID_UNTIL, e);
        }

        return TicketClaims.builder()
            .ticketId(String.valueOf(requiredClaim(claims, CLAIM_TICKET_ID)))
            .eventId(String.valueOf(requiredClaim(claims, CLAIM_EVENT_ID)))
            .issuer(String.valueOf(requiredClaim(claims, CLAIM_ISSUER)))
            .validUntil(validUntil)
            .issuedAt(toInstant(claims.getIssuedAt()))
            .expiresAt(toInstant(claims.getExpiration()))
            .build();
    }

    private Object requiredClaim(Claims claims, String name) {
        Object value = claims.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new TicketVerificationException(RejectionReason.TOKEN_INVALID,
                "Invalid token: missing " + name);
        }
        return value;
    }

    private Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
