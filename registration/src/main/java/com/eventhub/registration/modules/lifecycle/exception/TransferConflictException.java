package com.eventhub.registration.modules.lifecycle.exception;

import com.eventhub.registration.exception.RegistrationException;
import org.springframework.http.HttpStatus;

/**
 * Thrown when a transfer target is invalid: same event, or the identity is
 * already registered there.
 */
public class TransferConflictException extends RegistrationException {

    public TransferConflictException(String message) {
        super("TRANSFER_CONFLICT", message, false, HttpStatus.CONFLICT);
    }
}
