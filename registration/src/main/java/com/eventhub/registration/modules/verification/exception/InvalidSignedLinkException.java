package com.eventhub.registration.modules.verification.exception;

import com.eventhub.registration.exception.RegistrationException;
import org.springframework.http.HttpStatus;

/**
 * Signature mismatch, malformed payload, wrong event, or past its expiry.
 */
public class InvalidSignedLinkException extends RegistrationException {

    public InvalidSignedLinkException(String message) {
        super("INVALID_LINK", message, false, HttpStatus.UNAUTHORIZED);
    }
}
