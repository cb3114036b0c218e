package com.turnstile.common.store;

/**
 * Raised when the backing store cannot be reached or rejects a command.
 * Not retried by the verification core.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
