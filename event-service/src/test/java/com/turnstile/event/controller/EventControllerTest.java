package com.turnstile.event.controller;

import com.turnstile.common.dto.CurrentEventRequest;
import com.turnstile.common.model.CurrentEvent;
import com.turnstile.event.exception.EventNotFoundException;
import com.turnstile.event.service.EventService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventControllerTest {

    @Mock
    private EventService eventService;

    @InjectMocks
    private EventController eventController;

    private final CurrentEvent event = CurrentEvent.builder()
        .id("E1").name("Autumn Concert").maxCapacity(500).maxEntries(2).validity("2026-10-19").build();

    @Test
    void setEvent_Returns200WithEvent() {
        when(eventService.setCurrentEvent(any())).thenReturn(event);
        CurrentEventRequest request = CurrentEventRequest.builder()
            .eventId("E1").eventName("Autumn Concert").capacity(500L).maxEntries(2).eventValidity("2026-10-19").build();

        ResponseEntity<Map<String, Object>> response = eventController.setEvent(request);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(true, response.getBody().get("success"));
        assertSame(event, response.getBody().get("event"));
        verify(eventService).setCurrentEvent(request);
    }

    @Test
    void getEvent_Returns200WithEvent() {
        when(eventService.getCurrentEvent()).thenReturn(event);

        ResponseEntity<Map<String, Object>> response = eventController.getEvent();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(event, response.getBody().get("event"));
    }

    @Test
    void getEvent_None_Propagates() {
        when(eventService.getCurrentEvent()).thenThrow(new EventNotFoundException("No current event found"));

        assertThrows(EventNotFoundException.class, () -> eventController.getEvent());
    }

    @Test
    void deleteEvent_Returns200() {
        ResponseEntity<Map<String, Object>> response = eventController.deleteEvent();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("Current event deleted successfully", response.getBody().get("msg"));
        verify(eventService).deleteCurrentEvent();
    }
}
