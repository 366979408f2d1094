package com.eventhub.registration.modules.verification.exception;

import com.eventhub.registration.exception.RegistrationException;
import org.springframework.http.HttpStatus;

/**
 * The code did not match, or there is no live session for the identity.
 */
public class InvalidCodeException extends RegistrationException {

    private final int attemptsRemaining;

    public InvalidCodeException(String message, int attemptsRemaining) {
        super("INVALID_CODE", message, false, HttpStatus.UNAUTHORIZED);
        this.attemptsRemaining = attemptsRemaining;
    }

    /** -1 when no session existed. */
    public int getAttemptsRemaining() {
        return attemptsRemaining;
    }
}
