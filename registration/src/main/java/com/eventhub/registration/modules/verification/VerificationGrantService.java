package com.eventhub.registration.modules.verification;

import com.eventhub.registration.config.RegistrationProperties;
import com.eventhub.registration.modules.qualification.EmailMasker;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.modules.verification.exception.VerificationRequiredException;
import com.eventhub.registration.modules.verification.store.VerificationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Answers "has this e-mail been verified for this event, by this caller?". A
 * grant is recorded by code validation, redirect-token consumption and signed
 * links, and lives for {@code registration.grant.ttl}. Each recording mints a
 * fresh grant token and replaces the previous grant for the same address.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationGrantService {

    private static final int GRANT_TOKEN_BYTES = 32;

    private final VerificationStore verificationStore;
    private final RegistrationProperties properties;

    /**
     * Stores a grant for the profile's (event, e-mail) and returns the profile
     * stamped with its expiry.
     */
    public VerifiedProfile record(VerifiedProfile profile) {
        String email = EmailMasker.normalize(profile.getEmail());
        VerifiedProfile granted = profile.toBuilder()
                .email(email)
                .redirectToken(null)
                .grantToken(CryptoUtil.randomToken(GRANT_TOKEN_BYTES))
                .verifiedUntil(Instant.now().plus(properties.getGrant().getTtl()))
                .build();
        verificationStore.saveGrant(granted);
        log.debug("Verification grant recorded for {} on event {} until {}", EmailMasker.mask(email),
                granted.getEventId(), granted.getVerifiedUntil());
        return granted;
    }

    public Optional<VerifiedProfile> find(UUID eventId, String email) {
        String normalized = EmailMasker.normalize(email);
        if (normalized == null) {
            return Optional.empty();
        }
        return verificationStore.findGrant(eventId, normalized, Instant.now());
    }

    /**
     * @throws VerificationRequiredException when no live grant exists or
     *                                       {@code grantToken} is not its token
     */
    public VerifiedProfile require(UUID eventId, String email, String grantToken) {
        Optional<VerifiedProfile> grant = find(eventId, email);
        if (grant.isPresent() && CryptoUtil.constantTimeEquals(grant.get().getGrantToken(), grantToken)) {
            return grant.get();
        }
        if (grant.isPresent()) {
            log.warn("Grant token mismatch for {} on event {}", EmailMasker.mask(email), eventId);
        } else {
            log.info("Verification required for {} on event {}", EmailMasker.mask(email), eventId);
        }
        throw new VerificationRequiredException();
    }

    public void revoke(UUID eventId, String email) {
        String normalized = EmailMasker.normalize(email);
        if (normalized != null) {
            verificationStore.deleteGrant(eventId, normalized);
        }
    }
}
