package com.eventhub.registration.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class RegistrationNotFoundException extends RegistrationException {

    public RegistrationNotFoundException(UUID registrationId) {
        super("REGISTRATION_NOT_FOUND", "Registration not found: " + registrationId, true, HttpStatus.NOT_FOUND);
    }
}
