package com.turnstile.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.*;
import lombok.*;

/**
 * Administrative body for replacing the current event.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurrentEventRequest {

    @NotBlank(message = "event_id is required")
    @JsonProperty("event_id")
    private String eventId;

    @NotBlank(message = "event_name is required")
    @Size(max = 200, message = "event_name must not exceed 200 characters")
    @JsonProperty("event_name")
    private String eventName;

    @NotNull(message = "capacity is required")
    @Positive(message = "capacity must be positive")
    private Long capacity;

    // Optional: falls back to turnstile.event.default-max-entries
    @Positive(message = "max_entries must be positive")
    @JsonProperty("max_entries")
    private Integer maxEntries;

    @NotBlank(message = "event_validity is required")
    @JsonProperty("event_validity")
    private String eventValidity;
}
