package com.turnstile.event.controller;

import com.turnstile.common.dto.CurrentEventRequest;
import com.turnstile.common.model.CurrentEvent;
import com.turnstile.event.service.EventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/turnstile-callback")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Event Controller", description = "Current event management")
public class EventController {

    private final EventService eventService;

    @PostMapping("/set-event")
    @Operation(
        summary = "Set the current event",
        description = "Replaces the event the turnstiles admit to, including its capacity " +
                     "and the number of entries allowed per ticket."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Current event updated"),
        @ApiResponse(responseCode = "400", description = "One or more required fields not set"),
        @ApiResponse(responseCode = "503", description = "Store unavailable")
    })
    public ResponseEntity<Map<String, Object>> setEvent(@Valid @RequestBody CurrentEventRequest request) {
        log.info("Set current event request: id={} capacity={}", request.getEventId(), request.getCapacity());

        CurrentEvent event = eventService.setCurrentEvent(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("msg", "Current event updated");
        body.put("success", true);
        body.put("event", event);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/event")
    @Operation(summary = "Get the current event")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Current event found"),
        @ApiResponse(responseCode = "404", description = "No current event found")
    })
    public ResponseEntity<Map<String, Object>> getEvent() {
        CurrentEvent event = eventService.getCurrentEvent();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", event);
        body.put("success", true);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/delete-event")
    @Operation(summary = "Delete the current event", description = "Turnstiles reject every ticket until a new event is set.")
    @ApiResponse(responseCode = "200", description = "Current event deleted")
    public ResponseEntity<Map<String, Object>> deleteEvent() {
        eventService.deleteCurrentEvent();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("msg", "Current event deleted successfully");
        body.put("success", true);
        return ResponseEntity.ok(body);
    }
}
