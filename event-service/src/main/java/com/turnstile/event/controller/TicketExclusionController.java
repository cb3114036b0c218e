package com.turnstile.event.controller;

import com.turnstile.event.service.TicketExclusionService;
import com.turnstile.event.service.TicketExclusionService.ExclusionList;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/turnstile-callback")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Ticket Exclusion Controller", description = "Blacklist and revocation management")
public class TicketExclusionController {

    private final TicketExclusionService exclusionService;

    @PutMapping("/blacklist/{ticketId}")
    @Operation(summary = "Blacklist a ticket", description = "A blacklisted ticket is rejected at every gate.")
    public ResponseEntity<Map<String, Object>> blacklist(
            @PathVariable String ticketId,
            @Parameter(description = "Reason kept with the entry") @RequestParam(required = false) String reason,
            @Parameter(description = "Expire the entry after this many seconds") @RequestParam(required = false) Long ttlSeconds) {
        return exclude(ExclusionList.BLACKLIST, ticketId, reason, ttlSeconds);
    }

    @DeleteMapping("/blacklist/{ticketId}")
    @Operation(summary = "Remove a ticket from the blacklist")
    public ResponseEntity<Map<String, Object>> unblacklist(@PathVariable String ticketId) {
        return include(ExclusionList.BLACKLIST, ticketId);
    }

    @GetMapping("/blacklist/{ticketId}")
    @Operation(summary = "Check whether a ticket is blacklisted")
    public ResponseEntity<Map<String, Object>> isBlacklisted(@PathVariable String ticketId) {
        return status(ExclusionList.BLACKLIST, ticketId);
    }

    @PutMapping("/revoked/{ticketId}")
    @Operation(summary = "Revoke a ticket", description = "A revoked ticket is rejected at every gate.")
    public ResponseEntity<Map<String, Object>> revoke(
            @PathVariable String ticketId,
            @Parameter(description = "Reason kept with the entry") @RequestParam(required = false) String reason,
            @Parameter(description = "Expire the entry after this many seconds") @RequestParam(required = false) Long ttlSeconds) {
        return exclude(ExclusionList.REVOKED, ticketId, reason, ttlSeconds);
    }

    @DeleteMapping("/revoked/{ticketId}")
    @Operation(summary = "Reinstate a revoked ticket")
    public ResponseEntity<Map<String, Object>> reinstate(@PathVariable String ticketId) {
        return include(ExclusionList.REVOKED, ticketId);
    }

    @GetMapping("/revoked/{ticketId}")
    @Operation(summary = "Check whether a ticket is revoked")
    public ResponseEntity<Map<String, Object>> isRevoked(@PathVariable String ticketId) {
        return status(ExclusionList.REVOKED, ticketId);
    }

    private ResponseEntity<Map<String, Object>> exclude(ExclusionList list, String ticketId,
                                                        String reason, Long ttlSeconds) {
        if (ttlSeconds != null && ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }

        exclusionService.exclude(list, ticketId, reason, ttlSeconds != null ? Duration.ofSeconds(ttlSeconds) : null);
        return status(list, ticketId, true);
    }

    private ResponseEntity<Map<String, Object>> include(ExclusionList list, String ticketId) {
        exclusionService.include(list, ticketId);
        return status(list, ticketId, false);
    }

    private ResponseEntity<Map<String, Object>> status(ExclusionList list, String ticketId) {
        return status(list, ticketId, exclusionService.isExcluded(list, ticketId));
    }

    private ResponseEntity<Map<String, Object>> status(ExclusionList list, String ticketId, boolean excluded) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("ticketId", ticketId);
        body.put("list", list.name().toLowerCase());
        body.put("excluded", excluded);
        return ResponseEntity.ok(body);
    }
}
