package com.eventhub.registration.modules.verification;

import com.eventhub.registration.model.entity.Event;

import java.time.Duration;

/**
 * Delivers a verification code to an e-mail address.
 */
public interface VerificationCodeSender {

    /**
     * @throws com.eventhub.registration.modules.verification.exception.CodeDeliveryException
     *         when the code could not be handed to the mail provider
     */
    void send(String email, String code, Event event, Duration validFor);
}
