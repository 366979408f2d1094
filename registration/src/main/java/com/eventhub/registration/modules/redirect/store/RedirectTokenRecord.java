package com.eventhub.registration.modules.redirect.store;

import com.eventhub.registration.modules.verification.dto.VerifiedProfile;

import java.time.Instant;
import java.util.UUID;

/**
 * An issued, not yet consumed redirect token and the profile it carries.
 */
public record RedirectTokenRecord(String token, UUID eventId, String email, Instant expiresAt,
        VerifiedProfile profile) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
