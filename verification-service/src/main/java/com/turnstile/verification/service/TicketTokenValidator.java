package com.turnstile.verification.service;

public interface TicketTokenValidator {

    /**
     * Verify the token's signature and decode its claims
     *
     * @param token The token read from the QR code
     * @param secret The shared signing secret
     * @return The decoded claims
     * @throws TicketVerificationException with TOKEN_EXPIRED if the token's expiry has passed,
     *         TOKEN_INVALID for any other signature or format problem
     */
    TicketClaims verify(String token, String secret);
}
