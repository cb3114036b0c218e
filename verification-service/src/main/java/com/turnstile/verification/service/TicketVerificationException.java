package com.turnstile.verification.service;

/**
 * Business-rule rejection of a verification attempt. Never retried.
 */
public class TicketVerificationException extends RuntimeException {

    private final RejectionReason reason;

    public TicketVerificationException(RejectionReason reason) {
        this(reason, reason.getDefaultMessage());
    }

    public TicketVerificationException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TicketVerificationException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
