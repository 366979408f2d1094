package com.eventhub.registration.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Missing or malformed input. Carries the exact field ids so the caller can
 * point the user at them.
 */
@Getter
public class ValidationException extends RegistrationException {

    private final List<String> missingFields;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> missingFields) {
        super("VALIDATION_ERROR", message, false, HttpStatus.BAD_REQUEST);
        this.missingFields = List.copyOf(missingFields);
    }
}
