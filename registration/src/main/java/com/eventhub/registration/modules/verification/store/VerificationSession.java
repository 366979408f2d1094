package com.eventhub.registration.modules.verification.store;

import com.eventhub.registration.modules.qualification.QualificationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One live code for one (event, e-mail) pair. The e-mail is the address the
 * code was sent to, whether the caller claimed it directly or through a
 * distributor id, so both claims share a single session.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VerificationSession {

    private String sessionKey;
    private String sessionToken;
    /** Changes on every issue; a validation started against an older issue fails. */
    private String issueId;
    private UUID eventId;
    private String email;
    private String salt;
    private String codeHash;
    private Instant expiresAt;
    private int attempts;
    /** Qualification computed once at issue time. */
    private QualificationResult qualification;

    public static String keyOf(UUID eventId, String normalizedEmail) {
        return eventId + ":" + normalizedEmail;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
