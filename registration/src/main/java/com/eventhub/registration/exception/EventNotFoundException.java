package com.eventhub.registration.exception;

import org.springframework.http.HttpStatus;

public class EventNotFoundException extends RegistrationException {

    public EventNotFoundException(String eventRef) {
        super("EVENT_NOT_FOUND", "Event not found: " + eventRef, true, HttpStatus.NOT_FOUND);
    }
}
