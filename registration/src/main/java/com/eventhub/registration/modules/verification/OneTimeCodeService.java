package com.eventhub.registration.modules.verification;

import com.eventhub.registration.config.RegistrationProperties;
import com.eventhub.registration.exception.ValidationException;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.modules.qualification.EmailMasker;
import com.eventhub.registration.modules.qualification.QualificationResolver;
import com.eventhub.registration.modules.qualification.QualificationResult;
import com.eventhub.registration.modules.redirect.RedirectTokenService;
import com.eventhub.registration.modules.redirect.dto.IssuedRedirectToken;
import com.eventhub.registration.modules.verification.dto.IssueCodeResponse;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.modules.verification.exception.CodeAttemptsExhaustedException;
import com.eventhub.registration.modules.verification.exception.CodeDeliveryException;
import com.eventhub.registration.modules.verification.exception.CodeExpiredException;
import com.eventhub.registration.modules.verification.exception.InvalidCodeException;
import com.eventhub.registration.modules.verification.store.AttemptResult;
import com.eventhub.registration.modules.verification.store.VerificationSession;
import com.eventhub.registration.modules.verification.store.VerificationStore;
import com.eventhub.registration.service.AuditService;
import com.eventhub.registration.service.EventService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One-time codes proving control of an e-mail address for one event.
 * <ul>
 * <li>Qualification runs before any code exists; a rejected identity never
 * receives one</li>
 * <li>At most one live code per (event, e-mail): issuing replaces the previous
 * session, so resend is just another issue</li>
 * <li>Codes are stored salted and hashed, single-use, with a read-time TTL
 * check</li>
 * <li>The store serializes guesses per session; the last allowed wrong guess
 * destroys it</li>
 * <li>A valid code leaves a verification grant and a fresh redirect token</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OneTimeCodeService {

    private static final int SESSION_TOKEN_BYTES = 24;
    private static final int SALT_BYTES = 16;

    private final EventService eventService;
    private final QualificationResolver qualificationResolver;
    private final VerificationStore verificationStore;
    private final VerificationCodeSender codeSender;
    private final VerificationGrantService grantService;
    private final RedirectTokenService redirectTokenService;
    private final RegistrationProperties properties;
    private final AuditService auditService;

    public IssueCodeResponse issueCode(Event event, String email, String distributorId, String clientIp) {
        eventService.assertOpen(event);
        if (!event.getRegistrationMode().requiresVerification()) {
            throw new ValidationException("This event does not use email verification");
        }

        QualificationResult qualification = qualificationResolver.resolve(event, email, distributorId);
        if (qualification.email() == null) {
            throw new ValidationException("Email is required to send a verification code", List.of("email"));
        }

        RegistrationProperties.Code settings = properties.getCode();
        Duration ttl = settings.getTtl();
        String code = CryptoUtil.randomNumericCode(settings.getLength());
        String salt = CryptoUtil.randomToken(SALT_BYTES);
        String sessionKey = VerificationSession.keyOf(event.getId(), qualification.email());

        VerificationSession session = VerificationSession.builder()
                .sessionKey(sessionKey)
                .sessionToken(CryptoUtil.randomToken(SESSION_TOKEN_BYTES))
                .issueId(CryptoUtil.randomToken(SALT_BYTES))
                .eventId(event.getId())
                .email(qualification.email())
                .salt(salt)
                .codeHash(CryptoUtil.sha256Hex(salt, code))
                .expiresAt(Instant.now().plus(ttl))
                .attempts(0)
                .qualification(qualification)
                .build();

        verificationStore.saveSession(session);

        try {
            codeSender.send(qualification.email(), code, event, ttl);
        } catch (CodeDeliveryException e) {
            verificationStore.deleteSession(sessionKey);
            throw e;
        }

        String masked = EmailMasker.mask(qualification.email());
        auditService.log(masked, "CODE_ISSUED", "VerificationSession", null, event.getId(), clientIp,
                Map.of("emailMasked", qualification.emailMasked(), "source", qualification.source().name()));
        log.info("Verification code issued for {} on event {} (masked={})", masked, event.getId(),
                qualification.emailMasked());

        return IssueCodeResponse.builder()
                .sessionToken(session.getSessionToken())
                .emailMasked(qualification.emailMasked())
                .maskedEmail(qualification.emailMasked() ? masked : null)
                .expiresInSeconds(ttl.toSeconds())
                .build();
    }

    /**
     * Checks a code against the session found by {@code sessionToken} (preferred)
     * or {@code email}.
     *
     * @throws InvalidCodeException           wrong code, or no live session
     * @throws CodeExpiredException           the code outlived its TTL
     * @throws CodeAttemptsExhaustedException the attempt limit was reached
     */
    public VerifiedProfile validateCode(Event event, String email, String sessionToken, String code,
            String clientIp) {
        eventService.assertOpen(event);
        if (code == null || code.isBlank()) {
            throw new ValidationException("Verification code is required", List.of("code"));
        }

        String sessionKey = resolveSessionKey(event, email, sessionToken)
                .orElseThrow(() -> noActiveCode(event));
        VerificationSession session = verificationStore.findSession(sessionKey)
                .filter(s -> event.getId().equals(s.getEventId()))
                .orElseThrow(() -> noActiveCode(event));

        int maxAttempts = properties.getCode().getMaxAttempts();
        AttemptResult result = verificationStore.attempt(sessionKey, session.getIssueId(),
                CryptoUtil.sha256Hex(session.getSalt(), code.trim()), Instant.now(), maxAttempts);

        String masked = EmailMasker.mask(session.getEmail());
        switch (result.outcome()) {
            case VALIDATED -> {
                VerifiedProfile profile = grantService.record(toProfile(session));
                IssuedRedirectToken redirect = redirectTokenService.issue(event.getId(), session.getEmail(),
                        profile.getGrantToken(), null);
                auditService.log(masked, "CODE_VALIDATED", "VerificationSession", null, event.getId(), clientIp,
                        Map.of("verifiedByHydra", profile.isVerifiedByHydra()));
                log.info("Verification code validated for {} on event {}", masked, event.getId());
                return profile.toBuilder().redirectToken(redirect.token()).build();
            }
            case INVALID -> {
                int remaining = Math.max(maxAttempts - result.attempts(), 0);
                log.warn("Invalid verification code for {} on event {} ({} attempt(s) left)", masked,
                        event.getId(), remaining);
                throw new InvalidCodeException("Invalid verification code", remaining);
            }
            case EXHAUSTED -> {
                auditService.log(masked, "CODE_EXHAUSTED", "VerificationSession", null, event.getId(), clientIp,
                        Map.of("attempts", result.attempts()));
                log.warn("Verification attempts exhausted for {} on event {}", masked, event.getId());
                throw new CodeAttemptsExhaustedException();
            }
            case EXPIRED -> {
                log.warn("Expired verification code presented for {} on event {}", masked, event.getId());
                throw new CodeExpiredException();
            }
            default -> throw noActiveCode(event);
        }
    }

    /**
     * Discards the live session, if any ("use a different email"). Grants
     * already recorded are not touched.
     */
    public void discardSession(Event event, String email, String sessionToken) {
        resolveSessionKey(event, email, sessionToken).ifPresent(key -> {
            verificationStore.deleteSession(key);
            log.debug("Verification session discarded on event {}", event.getId());
        });
    }

    private Optional<String> resolveSessionKey(Event event, String email, String sessionToken) {
        if (sessionToken != null && !sessionToken.isBlank()) {
            return verificationStore.findSessionKeyByToken(sessionToken.trim());
        }
        String normalized = EmailMasker.normalize(email);
        if (normalized == null) {
            throw new ValidationException("Email or session token is required", List.of("email", "sessionToken"));
        }
        return Optional.of(VerificationSession.keyOf(event.getId(), normalized));
    }

    private InvalidCodeException noActiveCode(Event event) {
        log.warn("No active verification code on event {}", event.getId());
        return new InvalidCodeException("No active verification code. Request a new code.", -1);
    }

    private static VerifiedProfile toProfile(VerificationSession session) {
        QualificationResult q = session.getQualification();
        return VerifiedProfile.builder()
                .eventId(session.getEventId())
                .email(session.getEmail())
                .unicityId(q.distributorId())
                .firstName(q.firstName())
                .lastName(q.lastName())
                .phone(q.phone())
                .verifiedByHydra(q.verifiedByHydra())
                .qualificationSource(q.source())
                .build();
    }
}
