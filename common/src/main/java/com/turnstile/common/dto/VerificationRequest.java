package com.turnstile.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * Body posted by a turnstile device after scanning a QR code.
 * Extra device fields (image, temperature) are accepted and ignored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class VerificationRequest {

    @NotBlank(message = "deviceKey is required")
    private String deviceKey;

    @NotBlank(message = "time is required")
    private String time;

    @NotBlank(message = "qrcode is required")
    private String qrcode;
}
