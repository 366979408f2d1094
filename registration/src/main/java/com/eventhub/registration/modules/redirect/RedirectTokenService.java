package com.eventhub.registration.modules.redirect;

import com.eventhub.registration.config.RegistrationProperties;
import com.eventhub.registration.exception.ValidationException;
import com.eventhub.registration.modules.qualification.EmailMasker;
import com.eventhub.registration.modules.redirect.dto.IssuedRedirectToken;
import com.eventhub.registration.modules.redirect.exception.InvalidRedirectTokenException;
import com.eventhub.registration.modules.redirect.exception.RedirectTokenExpiredException;
import com.eventhub.registration.modules.redirect.store.ConsumeResult;
import com.eventhub.registration.modules.redirect.store.RedirectTokenRecord;
import com.eventhub.registration.modules.redirect.store.RedirectTokenStore;
import com.eventhub.registration.modules.verification.CryptoUtil;
import com.eventhub.registration.modules.verification.VerificationGrantService;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Single-use tokens that carry a verified identity across a navigation
 * boundary.
 * <ul>
 * <li>Issuing requires a live verification grant for (event, e-mail); the
 * token never widens what the caller has already proven</li>
 * <li>A token is bound to one (event, e-mail) and consumed at most once</li>
 * <li>Consuming records a fresh grant, the same as a validated code</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedirectTokenService {

    private static final int TOKEN_BYTES = 32;

    private final RedirectTokenStore redirectTokenStore;
    private final VerificationGrantService grantService;
    private final RegistrationProperties properties;
    private final AuditService auditService;

    /**
     * @param grantToken token of the caller's live verification grant
     * @param profile    optional display data; fields the grant already holds
     *                   take precedence
     */
    public IssuedRedirectToken issue(UUID eventId, String email, String grantToken, VerifiedProfile profile) {
        String normalized = EmailMasker.normalize(email);
        if (normalized == null) {
            throw new ValidationException("Email is required", List.of("email"));
        }
        VerifiedProfile granted = grantService.require(eventId, normalized, grantToken);
        VerifiedProfile carried = mergeDisplayFields(granted, profile).toBuilder()
                .grantToken(null)
                .build();

        String token = CryptoUtil.randomToken(TOKEN_BYTES);
        Instant expiresAt = Instant.now().plus(properties.getRedirectToken().getTtl());
        redirectTokenStore.save(new RedirectTokenRecord(token, eventId, normalized, expiresAt, carried));

        log.info("Redirect token issued for {} on event {} (expires {})", EmailMasker.mask(normalized), eventId,
                expiresAt);
        return new IssuedRedirectToken(token, expiresAt);
    }

    /**
     * @throws InvalidRedirectTokenException unknown, consumed or bound to another
     *                                       identity
     * @throws RedirectTokenExpiredException past its TTL
     */
    public VerifiedProfile consume(String token, String email, UUID eventId) {
        String normalized = EmailMasker.normalize(email);
        if (token == null || token.isBlank() || normalized == null) {
            throw new InvalidRedirectTokenException("Redirect token and email are required");
        }

        ConsumeResult result = redirectTokenStore.consume(token, eventId, normalized, Instant.now());

        switch (result.outcome()) {
            case CONSUMED -> {
                VerifiedProfile granted = grantService.record(result.profile());
                auditService.log(EmailMasker.mask(normalized), "REDIRECT_TOKEN_CONSUMED", "VerificationGrant",
                        null, eventId, null, null);
                log.info("Redirect token consumed for {} on event {}", EmailMasker.mask(normalized), eventId);
                return granted;
            }
            case EXPIRED -> {
                log.warn("Expired redirect token presented for event {}", eventId);
                throw new RedirectTokenExpiredException();
            }
            case MISMATCH -> {
                log.warn("Redirect token presented with a different identity for event {}", eventId);
                throw new InvalidRedirectTokenException("Invalid redirect token");
            }
            default -> {
                log.warn("Unknown or already used redirect token for event {}", eventId);
                throw new InvalidRedirectTokenException("Invalid or already used redirect token");
            }
        }
    }

    private static VerifiedProfile mergeDisplayFields(VerifiedProfile granted, VerifiedProfile supplied) {
        if (supplied == null) {
            return granted;
        }
        return granted.toBuilder()
                .firstName(granted.getFirstName() != null ? granted.getFirstName() : supplied.getFirstName())
                .lastName(granted.getLastName() != null ? granted.getLastName() : supplied.getLastName())
                .phone(granted.getPhone() != null ? granted.getPhone() : supplied.getPhone())
                .build();
    }
}
