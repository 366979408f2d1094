package com.eventhub.registration.exception;

import org.springframework.http.HttpStatus;

/**
 * Terminal: the event accepts no further submissions. Also raised with
 * {@code REGISTRATION_NOT_OPEN} for events that were never published.
 */
public class RegistrationClosedException extends RegistrationException {

    public RegistrationClosedException(String message) {
        super("REGISTRATION_CLOSED", message, true, HttpStatus.GONE);
    }

    private RegistrationClosedException(String errorCode, String message) {
        super(errorCode, message, true, HttpStatus.FORBIDDEN);
    }

    public static RegistrationClosedException notOpen() {
        return new RegistrationClosedException("REGISTRATION_NOT_OPEN", "Registration is not open for this event");
    }
}
