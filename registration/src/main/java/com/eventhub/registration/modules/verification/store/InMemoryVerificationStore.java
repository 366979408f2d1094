package com.eventhub.registration.modules.verification.store;

import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node verification store for local development and tests. Every
 * session transition runs inside {@link ConcurrentHashMap#compute}, which
 * serializes writers per key.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "registration.ephemeral-store", havingValue = "memory")
public class InMemoryVerificationStore implements VerificationStore {

    private final Map<String, VerificationSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> tokenIndex = new ConcurrentHashMap<>();
    private final Map<String, VerifiedProfile> grants = new ConcurrentHashMap<>();

    @Override
    public void saveSession(VerificationSession session) {
        sessions.compute(session.getSessionKey(), (key, previous) -> {
            if (previous != null) {
                tokenIndex.remove(previous.getSessionToken());
            }
            tokenIndex.put(session.getSessionToken(), key);
            return session.toBuilder().attempts(0).build();
        });
    }

    @Override
    public Optional<VerificationSession> findSession(String sessionKey) {
        return Optional.ofNullable(sessions.get(sessionKey));
    }

    @Override
    public Optional<String> findSessionKeyByToken(String sessionToken) {
        return Optional.ofNullable(tokenIndex.get(sessionToken));
    }

    @Override
    public AttemptResult attempt(String sessionKey, String issueId, String codeHash, Instant now, int maxAttempts) {
        AttemptResult[] result = { AttemptResult.of(AttemptOutcome.ABSENT, 0) };

        sessions.computeIfPresent(sessionKey, (key, session) -> {
            if (!session.getIssueId().equals(issueId)) {
                return session;
            }
            int attempts = session.getAttempts();
            if (session.isExpired(now)) {
                result[0] = AttemptResult.of(AttemptOutcome.EXPIRED, attempts);
                tokenIndex.remove(session.getSessionToken());
                return null;
            }
            if (attempts >= maxAttempts) {
                result[0] = AttemptResult.of(AttemptOutcome.EXHAUSTED, attempts);
                tokenIndex.remove(session.getSessionToken());
                return null;
            }
            if (session.getCodeHash().equals(codeHash)) {
                result[0] = AttemptResult.of(AttemptOutcome.VALIDATED, attempts);
                tokenIndex.remove(session.getSessionToken());
                return null;
            }
            attempts++;
            if (attempts >= maxAttempts) {
                result[0] = AttemptResult.of(AttemptOutcome.EXHAUSTED, attempts);
                tokenIndex.remove(session.getSessionToken());
                return null;
            }
            result[0] = AttemptResult.of(AttemptOutcome.INVALID, attempts);
            return session.toBuilder().attempts(attempts).build();
        });

        return result[0];
    }

    @Override
    public void deleteSession(String sessionKey) {
        VerificationSession removed = sessions.remove(sessionKey);
        if (removed != null) {
            tokenIndex.remove(removed.getSessionToken());
        }
    }

    @Override
    public void saveGrant(VerifiedProfile profile) {
        grants.put(grantKey(profile.getEventId(), profile.getEmail()), profile);
    }

    @Override
    public Optional<VerifiedProfile> findGrant(UUID eventId, String normalizedEmail, Instant now) {
        VerifiedProfile profile = grants.get(grantKey(eventId, normalizedEmail));
        if (profile == null || profile.getVerifiedUntil() == null || !now.isBefore(profile.getVerifiedUntil())) {
            return Optional.empty();
        }
        return Optional.of(profile);
    }

    @Override
    public void deleteGrant(UUID eventId, String normalizedEmail) {
        grants.remove(grantKey(eventId, normalizedEmail));
    }

    /**
     * Drops expired sessions and grants. Only frees memory; lookups already
     * treat expired entries as absent.
     */
    public int purgeExpired(Instant now) {
        int before = sessions.size() + grants.size();
        sessions.entrySet().removeIf(e -> {
            if (e.getValue().isExpired(now)) {
                tokenIndex.remove(e.getValue().getSessionToken());
                return true;
            }
            return false;
        });
        grants.values().removeIf(g -> g.getVerifiedUntil() == null || !now.isBefore(g.getVerifiedUntil()));
        return before - (sessions.size() + grants.size());
    }

    int sessionCount() {
        return sessions.size();
    }

    private static String grantKey(UUID eventId, String normalizedEmail) {
        return eventId + ":" + normalizedEmail;
    }
}
