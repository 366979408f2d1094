package com.eventhub.registration.service;

import com.eventhub.registration.exception.EventNotFoundException;
import com.eventhub.registration.exception.RegistrationClosedException;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.EventStatus;
import com.eventhub.registration.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to events for the registration flow. Events are addressed
 * by id or by slug.
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class EventService {

    private final EventRepository eventRepository;

    public Event requireEvent(String eventRef) {
        if (eventRef == null || eventRef.isBlank()) {
            throw new EventNotFoundException(String.valueOf(eventRef));
        }
        return findByRef(eventRef.trim()).orElseThrow(() -> new EventNotFoundException(eventRef));
    }

    public Event requireEvent(UUID eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException(String.valueOf(eventId)));
    }

    /**
     * Resolves the event and fails closed unless it currently accepts
     * registrations. The closed flag wins over every other state.
     */
    public Event requireOpen(String eventRef) {
        Event event = requireEvent(eventRef);
        assertOpen(event);
        return event;
    }

    public Event requireOpen(UUID eventId) {
        Event event = requireEvent(eventId);
        assertOpen(event);
        return event;
    }

    public void assertOpen(Event event) {
        if (event.isRegistrationClosed()) {
            log.info("Registration closed for event {} at {}", event.getId(), event.getRegistrationClosedAt());
            throw new RegistrationClosedException("Registration for this event is closed");
        }
        if (event.getStatus() != EventStatus.PUBLISHED) {
            log.info("Event {} is not published (status={})", event.getId(), event.getStatus());
            throw RegistrationClosedException.notOpen();
        }
    }

    private Optional<Event> findByRef(String eventRef) {
        try {
            return eventRepository.findById(UUID.fromString(eventRef));
        } catch (IllegalArgumentException notUuid) {
            return eventRepository.findBySlug(eventRef);
        }
    }
}
