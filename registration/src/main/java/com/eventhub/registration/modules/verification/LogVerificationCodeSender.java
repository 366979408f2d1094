package com.eventhub.registration.modules.verification;

import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.modules.qualification.EmailMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Development sender: writes the code to the application log instead of
 * mailing it. Never enable outside local environments.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "registration.delivery.mode", havingValue = "log", matchIfMissing = true)
public class LogVerificationCodeSender implements VerificationCodeSender {

    @Override
    public void send(String email, String code, Event event, Duration validFor) {
        log.warn("[DEV] Verification code for {} on event {} (valid {} min): {}",
                EmailMasker.mask(email), event.getSlug() != null ? event.getSlug() : event.getId(),
                validFor.toMinutes(), code);
    }
}
