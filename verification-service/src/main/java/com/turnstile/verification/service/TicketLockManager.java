package com.turnstile.verification.service;

public interface TicketLockManager {

    /**
     * Take the per-ticket lock if nobody holds it
     *
     * @param ticketId The ticket being verified
     * @return true if the lock is now held by the caller, false if it was already held
     */
    boolean acquire(String ticketId);

    /**
     * Remove the per-ticket lock
     *
     * @param ticketId The ticket being verified
     */
    void release(String ticketId);

    /**
     * Run a task while holding the per-ticket lock. The lock is released on every exit path.
     *
     * @param ticketId The ticket being verified
     * @param task The task to run under the lock
     * @return The task's result
     * @throws TicketVerificationException with CONCURRENT_PROCESSING if the lock is already held
     */
    <T> T executeWithLock(String ticketId, LockedTask<T> task);

    /**
     * Work performed while holding a ticket lock
     */
    @FunctionalInterface
    interface LockedTask<T> {
        T execute();
    }
}
