package com.turnstile.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.turnstile.common.model.TicketRecord;
import lombok.*;

/**
 * Decision payload returned to the scanning device.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResponse {

    private boolean success;

    // Echoes the device key
    private String code;

    private TicketRecord data;

    // 1 tells the device to open the gate
    private Integer result;

    private String msg;

    public static VerificationResponse admitted(String deviceKey, TicketRecord ticket) {
        return VerificationResponse.builder()
            .success(true)
            .code(deviceKey)
            .data(ticket)
            .result(1)
            .msg("success")
            .build();
    }
}
