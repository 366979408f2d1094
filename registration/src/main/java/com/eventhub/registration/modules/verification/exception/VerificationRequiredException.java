package com.eventhub.registration.modules.verification.exception;

import com.eventhub.registration.exception.RegistrationException;
import org.springframework.http.HttpStatus;

/**
 * A verified-mode submission arrived without a live verification grant for the
 * identity. Recoverable: verify the e-mail, then resubmit the same payload.
 */
public class VerificationRequiredException extends RegistrationException {

    public VerificationRequiredException() {
        super("VERIFICATION_REQUIRED", "Email verification is required before submitting.", false,
                HttpStatus.UNAUTHORIZED);
    }
}
