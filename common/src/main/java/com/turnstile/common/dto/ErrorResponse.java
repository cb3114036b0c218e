package com.turnstile.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private final boolean success = false;

    private LocalDateTime timestamp;
    private int status;
    private String error;

    // Rejection kind, e.g. ALREADY_INSIDE
    private String kind;

    private String message;
    private String path;
    private Map<String, String> validationErrors;
}
