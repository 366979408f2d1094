package com.eventhub.registration.modules.qualification.exception;

import com.eventhub.registration.exception.RegistrationException;
import org.springframework.http.HttpStatus;

/**
 * Terminal for the identity that was tried: it is not on the event's qualified
 * list, or the qualification window excludes it. Never carries the e-mail.
 */
public class NotQualifiedException extends RegistrationException {

    public NotQualifiedException(String reason) {
        super("NOT_QUALIFIED", reason, true, HttpStatus.FORBIDDEN);
    }
}
