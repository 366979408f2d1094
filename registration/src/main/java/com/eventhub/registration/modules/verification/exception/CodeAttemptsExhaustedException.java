package com.eventhub.registration.modules.verification.exception;

import com.eventhub.registration.exception.RegistrationException;
import org.springframework.http.HttpStatus;

/**
 * Too many wrong guesses. The session is gone; only a fresh code helps.
 */
public class CodeAttemptsExhaustedException extends RegistrationException {

    public CodeAttemptsExhaustedException() {
        super("CODE_EXHAUSTED", "Too many incorrect attempts. Request a new code.", false,
                HttpStatus.TOO_MANY_REQUESTS);
    }
}
