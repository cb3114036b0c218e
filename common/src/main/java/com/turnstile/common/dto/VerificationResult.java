package com.turnstile.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.turnstile.common.model.TicketRecord;
import lombok.*;

import java.time.Instant;

/**
 * Outcome of a queued verification, published under the job's id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResult {

    private String jobId;

    private boolean admitted;

    // Rejection or fault kind, absent on admission
    private String reason;

    private String message;

    private TicketRecord ticket;

    private Instant processedAt;
}
