package com.turnstile.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single active event consulted by every verification.
 * Stored as the Redis hash {@code current_event}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurrentEvent {

    static final String FIELD_ID = "id";
    static final String FIELD_NAME = "name";
    static final String FIELD_MAX_CAPACITY = "max_capacity";
    static final String FIELD_MAX_ENTRIES = "max_entries";
    static final String FIELD_VALIDITY = "validity";

    private String id;

    private String name;

    @JsonProperty("max_capacity")
    private long maxCapacity;

    @JsonProperty("max_entries")
    private int maxEntries;

    private String validity;

    public Map<String, String> toHash() {
        Map<String, String> hash = new LinkedHashMap<>();
        hash.put(FIELD_ID, id);
        hash.put(FIELD_NAME, name);
        hash.put(FIELD_MAX_CAPACITY, String.valueOf(maxCapacity));
        hash.put(FIELD_MAX_ENTRIES, String.valueOf(maxEntries));
        hash.put(FIELD_VALIDITY, validity);
        return hash;
    }

    /**
     * Rebuild the event from its hash fields.
     *
     * @throws IllegalArgumentException if a required field is missing or not a positive number
     */
    public static CurrentEvent fromHash(Map<String, String> hash) {
        return CurrentEvent.builder()
            .id(required(hash, FIELD_ID))
            .name(hash.get(FIELD_NAME))
            .maxCapacity(positive(hash, FIELD_MAX_CAPACITY))
            .maxEntries(positiveInt(hash, FIELD_MAX_ENTRIES))
            .validity(hash.get(FIELD_VALIDITY))
            .build();
    }

    private static String required(Map<String, String> hash, String field) {
        String value = hash.get(field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Current event is missing field: " + field);
        }
        return value;
    }

    private static int positiveInt(Map<String, String> hash, String field) {
        long value = positive(hash, field);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Current event field " + field + " is out of range: " + value, e);
        }
    }

    private static long positive(Map<String, String> hash, String field) {
        String raw = required(hash, field);
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Current event field " + field + " is not a number: " + raw, e);
        }
        if (value <= 0) {
            throw new IllegalArgumentException("Current event field " + field + " must be positive: " + raw);
        }
        return value;
    }
}
