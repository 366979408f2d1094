package com.eventhub.registration.modules.verification.exception;

import com.eventhub.registration.exception.RegistrationException;
import org.springframework.http.HttpStatus;

public class CodeExpiredException extends RegistrationException {

    public CodeExpiredException() {
        super("CODE_EXPIRED", "Verification code has expired. Request a new code.", false, HttpStatus.UNAUTHORIZED);
    }
}
