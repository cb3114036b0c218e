package com.turnstile.verification.controller;

import com.turnstile.common.dto.VerificationJob;
import com.turnstile.common.dto.VerificationRequest;
import com.turnstile.common.dto.VerificationResponse;
import com.turnstile.common.model.TicketRecord;
import com.turnstile.common.util.Timestamps;
import com.turnstile.verification.service.TicketVerificationException;
import com.turnstile.verification.service.VerificationEngine;
import com.turnstile.verification.service.VerificationJobQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/turnstile-callback")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Verification Controller", description = "Gate-side ticket verification")
public class VerificationController {

    private final VerificationEngine verificationEngine;
    private final VerificationJobQueue jobQueue;

    @PostMapping("/verify-ticket")
    @Operation(
        summary = "Verify a scanned ticket",
        description = "Called by the turnstile device after reading a QR code. " +
                     "Admits the holder and records the entry, or rejects with the reason."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Ticket admitted"),
        @ApiResponse(responseCode = "400", description = "Missing parameters or ticket rejected"),
        @ApiResponse(responseCode = "503", description = "Store unavailable")
    })
    public ResponseEntity<VerificationResponse> verifyTicket(@Valid @RequestBody VerificationRequest request) {
        log.info("Verification request from device: {}", request.getDeviceKey());

        Instant scanTime = Timestamps.parse(request.getTime());

        try {
            TicketRecord ticket = verificationEngine.verify(request.getQrcode(), request.getDeviceKey(), scanTime);
            return ResponseEntity.ok(VerificationResponse.admitted(request.getDeviceKey(), ticket));

        } catch (TicketVerificationException e) {
            log.warn("Error verifying ticket from device: {} - {}", request.getDeviceKey(), e.getMessage());
            throw e; // Will be handled by global exception handler
        }
    }

    @PostMapping("/verification-jobs")
    @Operation(
        summary = "Queue a verification for asynchronous replay",
        description = "Publishes the scan to the verification job queue. The decision is logged " +
                     "and published to the results topic under the returned job id."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "202", description = "Job queued"),
        @ApiResponse(responseCode = "400", description = "Missing or invalid parameters")
    })
    public ResponseEntity<Map<String, Object>> enqueueVerification(@Valid @RequestBody VerificationRequest request) {
        VerificationJob job = VerificationJob.builder()
            .token(request.getQrcode())
            .deviceKey(request.getDeviceKey())
            .scanTime(Timestamps.parse(request.getTime()))
            .build();

        String jobId = jobQueue.enqueue(job);
        log.info("Verification job {} queued for device: {}", jobId, request.getDeviceKey());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("success", true, "jobId", jobId));
    }
}
