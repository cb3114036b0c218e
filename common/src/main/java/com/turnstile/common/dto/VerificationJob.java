package com.turnstile.common.dto;

import lombok.*;

import java.time.Instant;

/**
 * Verification request replayed through the job queue.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class VerificationJob {

    // Correlates the job with its published result
    private String jobId;

    private String token;

    private String deviceKey;

    private Instant scanTime;

    private int attempt;
}
