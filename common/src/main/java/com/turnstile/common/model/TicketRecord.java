package com.turnstile.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.turnstile.common.enums.EntryStatus;
import com.turnstile.common.enums.TicketStatus;
import lombok.*;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server-side entry record of one ticket, stored as the Redis hash {@code ticket:<ticket_id>}.
 * Created on the first admission and replaced wholesale on every later admission.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TicketRecord {

    @JsonProperty("ticket_id")
    private String ticketId;

    @JsonProperty("event_id")
    private String eventId;

    private String issuer;

    @JsonProperty("valid_until")
    private Instant validUntil;

    private TicketStatus status;

    @JsonProperty("entry_status")
    private EntryStatus entryStatus;

    @JsonProperty("entry_count")
    private int entryCount;

    @JsonProperty("device_id")
    private String deviceId;

    private Instant scanned;

    public Map<String, String> toHash() {
        Map<String, String> hash = new LinkedHashMap<>();
        hash.put("ticket_id", ticketId);
        hash.put("event_id", eventId);
        putIfPresent(hash, "issuer", issuer);
        putIfPresent(hash, "valid_until", validUntil);
        hash.put("status", status.getValue());
        hash.put("entry_status", entryStatus.getValue());
        hash.put("entry_count", String.valueOf(entryCount));
        putIfPresent(hash, "device_id", deviceId);
        putIfPresent(hash, "scanned", scanned);
        return hash;
    }

    /**
     * Rebuild a record from its hash fields.
     *
     * @throws IllegalArgumentException if the stored record is incomplete or malformed
     */
    public static TicketRecord fromHash(Map<String, String> hash) {
        try {
            return TicketRecord.builder()
                .ticketId(required(hash, "ticket_id"))
                .eventId(hash.get("event_id"))
                .issuer(hash.get("issuer"))
                .validUntil(instant(hash.get("valid_until")))
                .status(TicketStatus.fromValue(required(hash, "status")))
                .entryStatus(EntryStatus.fromValue(required(hash, "entry_status")))
                .entryCount(Integer.parseInt(required(hash, "entry_count").trim()))
                .deviceId(hash.get("device_id"))
                .scanned(instant(hash.get("scanned")))
                .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed ticket record: " + hash.get("ticket_id"), e);
        }
    }

    private static void putIfPresent(Map<String, String> hash, String field, Object value) {
        if (value != null) {
            hash.put(field, value.toString());
        }
    }

    private static String required(Map<String, String> hash, String field) {
        String value = hash.get(field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Ticket record is missing field: " + field);
        }
        return value;
    }

    private static Instant instant(String value) {
        return value == null || value.isBlank() ? null : Instant.parse(value);
    }
}
