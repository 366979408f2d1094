package com.eventhub.registration.modules.redirect.store;

import com.eventhub.registration.modules.verification.dto.VerifiedProfile;

/**
 * @param profile only set for {@link ConsumeOutcome#CONSUMED}
 */
public record ConsumeResult(ConsumeOutcome outcome, VerifiedProfile profile) {

    public static ConsumeResult of(ConsumeOutcome outcome) {
        return new ConsumeResult(outcome, null);
    }
}
