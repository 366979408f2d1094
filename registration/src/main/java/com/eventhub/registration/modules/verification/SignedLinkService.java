package com.eventhub.registration.modules.verification;

import com.eventhub.registration.config.RegistrationProperties;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.modules.qualification.EmailMasker;
import com.eventhub.registration.modules.qualification.QualificationResolver;
import com.eventhub.registration.modules.qualification.QualificationResult;
import com.eventhub.registration.modules.verification.dto.SignedIdentity;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.modules.verification.exception.InvalidSignedLinkException;
import com.eventhub.registration.service.AuditService;
import com.eventhub.registration.service.EventService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

/**
 * HMAC-SHA256 signed identity links.
 * <p>
 * Token format: {@code base64url(json) + "." + base64url(hmac(json))}. A valid
 * link stands in for the code step only: the closed check and qualification
 * still run before a grant is recorded.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignedLinkService {

    private final RegistrationProperties properties;
    private final EventService eventService;
    private final QualificationResolver qualificationResolver;
    private final VerificationGrantService grantService;
    private final AuditService auditService;
    private final ObjectMapper objectMapper;

    public String issue(Event event, String email, String distributorId, Duration validFor) {
        String secret = requireSecret();
        Duration maxAge = properties.getSignedLink().getMaxAge();
        Duration lifetime = validFor == null || validFor.compareTo(maxAge) > 0 ? maxAge : validFor;

        SignedIdentity identity = new SignedIdentity(event.getId(), EmailMasker.normalize(email),
                distributorId, Instant.now().plus(lifetime));

        String payload;
        try {
            payload = CryptoUtil.base64Url(objectMapper.writeValueAsBytes(identity));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize signed link", e);
        }
        String signature = CryptoUtil.base64Url(CryptoUtil.hmacSha256(secret, payload));

        log.info("Signed link issued for {} on event {} (expires {})", EmailMasker.mask(identity.email()),
                event.getId(), identity.expiresAt());
        return payload + "." + signature;
    }

    /**
     * Checks signature and expiry only.
     *
     * @throws InvalidSignedLinkException on any defect
     */
    public SignedIdentity verify(String token) {
        String secret = properties.getSignedLink().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new InvalidSignedLinkException("Signed links are not enabled");
        }
        if (token == null) {
            throw new InvalidSignedLinkException("Invalid link");
        }

        int dot = token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1) {
            throw new InvalidSignedLinkException("Invalid link");
        }
        String payload = token.substring(0, dot);
        String signature = token.substring(dot + 1);

        String expected = CryptoUtil.base64Url(CryptoUtil.hmacSha256(secret, payload));
        if (!CryptoUtil.constantTimeEquals(expected, signature)) {
            log.warn("Signed link with a bad signature rejected");
            throw new InvalidSignedLinkException("Invalid link");
        }

        SignedIdentity identity;
        try {
            String json = new String(Base64.getUrlDecoder().decode(payload), StandardCharsets.UTF_8);
            identity = objectMapper.readValue(json, SignedIdentity.class);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new InvalidSignedLinkException("Invalid link");
        }

        if (identity.expiresAt() == null || !Instant.now().isBefore(identity.expiresAt())) {
            throw new InvalidSignedLinkException("This link has expired");
        }
        return identity;
    }

    /**
     * Verifies the link for {@code event}, runs the closed check and
     * qualification, then records a grant.
     */
    public VerifiedProfile accept(Event event, String token, String clientIp) {
        eventService.assertOpen(event);
        SignedIdentity identity = verify(token);
        if (!event.getId().equals(identity.eventId())) {
            log.warn("Signed link for event {} presented on event {}", identity.eventId(), event.getId());
            throw new InvalidSignedLinkException("This link belongs to a different event");
        }

        QualificationResult q = qualificationResolver.resolve(event, identity.email(), identity.distributorId());

        VerifiedProfile granted = grantService.record(VerifiedProfile.builder()
                .eventId(event.getId())
                .email(q.email())
                .unicityId(q.distributorId())
                .firstName(q.firstName())
                .lastName(q.lastName())
                .phone(q.phone())
                .verifiedByHydra(q.verifiedByHydra())
                .qualificationSource(q.source())
                .build());

        auditService.log(EmailMasker.mask(q.email()), "SIGNED_LINK_ACCEPTED", "VerificationGrant", null,
                event.getId(), clientIp, Map.of("source", q.source().name()));
        return granted;
    }

    private String requireSecret() {
        String secret = properties.getSignedLink().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("registration.signed-link.secret is not configured");
        }
        return secret;
    }
}
