package com.turnstile.event.service;

import com.turnstile.common.dto.CurrentEventRequest;
import com.turnstile.common.model.CurrentEvent;
import com.turnstile.common.service.CurrentEventRegistry;
import com.turnstile.event.exception.EventNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class EventService {

    private final CurrentEventRegistry eventRegistry;
    private final int defaultMaxEntries;

    public EventService(CurrentEventRegistry eventRegistry,
                        @Value("${turnstile.event.default-max-entries:1}") int defaultMaxEntries) {
        this.eventRegistry = eventRegistry;
        this.defaultMaxEntries = defaultMaxEntries;
    }

    /**
     * Replace the event the gate admits to
     */
    public CurrentEvent setCurrentEvent(CurrentEventRequest request) {
        CurrentEvent event = CurrentEvent.builder()
            .id(request.getEventId())
            .name(request.getEventName())
            .maxCapacity(request.getCapacity())
            .maxEntries(request.getMaxEntries() != null ? request.getMaxEntries() : defaultMaxEntries)
            .validity(request.getEventValidity())
            .build();

        eventRegistry.replace(event);
        return event;
    }

    public CurrentEvent getCurrentEvent() {
        return eventRegistry.current()
            .orElseThrow(() -> new EventNotFoundException("No current event found"));
    }

    public void deleteCurrentEvent() {
        eventRegistry.delete();
    }
}
