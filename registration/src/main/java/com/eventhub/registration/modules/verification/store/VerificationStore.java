package com.eventhub.registration.modules.verification.store;

import com.eventhub.registration.modules.verification.dto.VerifiedProfile;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Ephemeral state of the code flow: verification sessions and the grants that
 * successful verifications leave behind.
 * <p>
 * Implementations must make {@link #saveSession} replace any previous session
 * for the same key (including its token index entry) and must run
 * {@link #attempt} as one atomic step per session.
 * </p>
 */
public interface VerificationStore {

    void saveSession(VerificationSession session);

    Optional<VerificationSession> findSession(String sessionKey);

    Optional<String> findSessionKeyByToken(String sessionToken);

    /**
     * Checks one guess. {@code codeHash} must have been computed with the salt
     * of the session identified by {@code issueId}.
     */
    AttemptResult attempt(String sessionKey, String issueId, String codeHash, Instant now, int maxAttempts);

    void deleteSession(String sessionKey);

    void saveGrant(VerifiedProfile profile);

    /** Grant is only returned while {@code verifiedUntil} is after {@code now}. */
    Optional<VerifiedProfile> findGrant(UUID eventId, String normalizedEmail, Instant now);

    void deleteGrant(UUID eventId, String normalizedEmail);
}
