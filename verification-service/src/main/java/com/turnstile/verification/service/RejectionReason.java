package com.turnstile.verification.service;

/**
 * Why a verification attempt was denied.
 */
public enum RejectionReason {
    NO_ACTIVE_EVENT("No current event found"),
    TOKEN_EXPIRED("Token has expired"),
    TOKEN_INVALID("Invalid token"),
    ISSUER_MISMATCH("Ticket was not issued by the configured issuer"),
    TICKET_EXPIRED("Ticket has expired"),
    EVENT_MISMATCH("The event ID does not match the current event"),
    BLACKLISTED("Ticket has been blacklisted"),
    REVOKED("This ticket has been revoked"),
    CONCURRENT_PROCESSING("Ticket is being processed, please wait"),
    EVENT_FULL("Event is at full capacity"),
    ALREADY_INSIDE("Ticket has already been used for entry. The client is still inside the event center"),
    MAX_ENTRIES_REACHED("Ticket has reached the maximum number of allowed entries"),
    TICKET_INVALID_OR_REVOKED("Ticket is invalid or has been revoked");

    private final String defaultMessage;

    RejectionReason(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
