package com.eventhub.registration.modules.flow;

import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.modules.redirect.RedirectTokenService;
import com.eventhub.registration.modules.submission.RegistrationSubmissionService;
import com.eventhub.registration.modules.verification.OneTimeCodeService;
import com.eventhub.registration.modules.verification.SignedLinkService;
import com.eventhub.registration.service.EventService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Creates one {@link RegistrationFlow} per registrant session.
 */
@Component
@RequiredArgsConstructor
public class RegistrationFlowFactory {

    private final EventService eventService;
    private final OneTimeCodeService oneTimeCodeService;
    private final RedirectTokenService redirectTokenService;
    private final SignedLinkService signedLinkService;
    private final RegistrationSubmissionService submissionService;

    public RegistrationFlow create(String eventRef, String clientIp) {
        Event event = eventService.requireEvent(eventRef);
        return new RegistrationFlow(event, clientIp, eventService, oneTimeCodeService, redirectTokenService,
                signedLinkService, submissionService);
    }
}
