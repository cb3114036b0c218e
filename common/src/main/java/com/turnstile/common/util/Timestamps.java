package com.turnstile.common.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Parses the timestamp formats sent by scanning devices and carried in ticket tokens.
 * Values without an offset are read as UTC.
 */
public class Timestamps {

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
    );

    /**
     * Parse epoch milliseconds, an ISO-8601 instant or offset date-time, or a local date-time.
     *
     * @throws IllegalArgumentException if the value matches none of the supported formats
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Timestamp is required");
        }

        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(trimmed));
        }

        Instant instant = parseOffset(trimmed);
        for (int i = 0; instant == null && i < LOCAL_FORMATS.size(); i++) {
            instant = parseLocal(trimmed, LOCAL_FORMATS.get(i));
        }
        if (instant != null) {
            return instant;
        }

        throw new IllegalArgumentException("Unsupported timestamp: " + value);
    }

    private static Instant parseOffset(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant parseLocal(String value, DateTimeFormatter format) {
        try {
            return LocalDateTime.parse(value, format).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Convert a decoded claim value (number of epoch milliseconds or string) to an instant.
     */
    public static Instant fromClaim(Object value) {
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof String text) {
            return parse(text);
        }
        throw new IllegalArgumentException("Unsupported timestamp claim: " + value);
    }
}
