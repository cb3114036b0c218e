package com.turnstile.common.store;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Key/value and hash store shared by every verification attempt.
 *
 * Every call may block on network I/O. Implementations surface connectivity
 * problems as {@link StoreUnavailableException}.
 */
public interface CacheStore {

    /**
     * Read a plain value
     *
     * @param key The key to read
     * @return The value, or empty if the key does not exist
     */
    Optional<String> get(String key);

    /**
     * Write a plain value without expiry
     */
    void set(String key, String value);

    /**
     * Write a plain value that expires after the given TTL
     */
    void set(String key, String value, Duration ttl);

    /**
     * Write a value only if the key does not exist yet
     *
     * @return true if the value was written, false if the key was already present
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Check whether a key exists
     */
    boolean exists(String key);

    /**
     * Read all fields of a hash
     *
     * @return The fields, or an empty map if the hash does not exist
     */
    Map<String, String> hGetAll(String key);

    /**
     * Write the given fields into a hash, leaving other fields untouched
     */
    void hSet(String key, Map<String, String> fields);

    /**
     * Atomically replace a whole hash with the given fields. Readers see either the old
     * hash or the new one, and a failed call leaves the old hash in place.
     */
    void hReplace(String key, Map<String, String> fields);

    /**
     * Delete a key of any type
     */
    void del(String key);

    /**
     * Atomically increment a counter while it is strictly below the limit.
     * A missing counter counts as zero.
     *
     * @return The incremented value, or empty if the counter had already reached the limit
     */
    OptionalLong incrementIfBelow(String key, long limit);

    /**
     * Atomically decrement a counter without letting it drop below zero.
     *
     * @return The value after the decrement
     */
    long decrementIfPositive(String key);

    /**
     * Liveness probe
     *
     * @return true if the store answered, false otherwise
     */
    boolean ping();
}
