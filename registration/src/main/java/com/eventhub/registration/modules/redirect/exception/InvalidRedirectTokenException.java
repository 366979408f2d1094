package com.eventhub.registration.modules.redirect.exception;

import com.eventhub.registration.exception.RegistrationException;
import org.springframework.http.HttpStatus;

/**
 * Thrown when a redirect token is unknown, already consumed, or bound to a
 * different identity or event.
 */
public class InvalidRedirectTokenException extends RegistrationException {

    public InvalidRedirectTokenException(String message) {
        super("INVALID_TOKEN", message, false, HttpStatus.UNAUTHORIZED);
    }
}
