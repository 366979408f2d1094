package com.eventhub.registration.modules.redirect.exception;

import com.eventhub.registration.exception.RegistrationException;
import org.springframework.http.HttpStatus;

public class RedirectTokenExpiredException extends RegistrationException {

    public RedirectTokenExpiredException() {
        super("TOKEN_EXPIRED", "Redirect token has expired", false, HttpStatus.UNAUTHORIZED);
    }
}
