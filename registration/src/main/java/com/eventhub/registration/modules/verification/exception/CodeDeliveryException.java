package com.eventhub.registration.modules.verification.exception;

import com.eventhub.registration.exception.RegistrationException;
import org.springframework.http.HttpStatus;

public class CodeDeliveryException extends RegistrationException {

    public CodeDeliveryException(String message, Throwable cause) {
        super("CODE_DELIVERY_FAILED", message, false, HttpStatus.SERVICE_UNAVAILABLE, cause);
    }
}
