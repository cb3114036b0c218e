package com.turnstile.common.store;

/**
 * Redis key layout shared by the verification and event services.
 */
public final class CacheKeys {

    public static final String CURRENT_EVENT = "current_event";
    public static final String CURRENT_ATTENDEES_COUNT = "current_attendees_count";

    private CacheKeys() {
    }

    public static String ticket(String ticketId) {
        return "ticket:" + ticketId;
    }

    public static String lock(String ticketId) {
        return "lock:" + ticketId;
    }

    public static String blacklist(String ticketId) {
        return "blacklist:" + ticketId;
    }

    public static String revoked(String ticketId) {
        return "revoked:" + ticketId;
    }
}
