package com.eventhub.registration.modules.qualification;

import com.eventhub.registration.exception.ValidationException;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.QualifiedRegistrant;
import com.eventhub.registration.model.entity.Registration;
import com.eventhub.registration.modules.qualification.exception.NotQualifiedException;
import com.eventhub.registration.repository.QualifiedRegistrantRepository;
import com.eventhub.registration.repository.RegistrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a claimed identity may register for an event.
 * <p>
 * Lookup order for events that require qualification:
 * </p>
 * <ol>
 * <li>distributor id against the qualified list, then against verified
 * registrations</li>
 * <li>e-mail (case-insensitive) against existing registrations, then against
 * the qualified list</li>
 * </ol>
 * <p>
 * The qualification window only restricts qualified-list matches. A profile
 * found through a bare distributor id carries the real address server-side but
 * is only ever shown masked.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualificationResolver {

    static final String MSG_ON_LIST = "You are on the qualified registrants list.";
    static final String MSG_PRE_QUALIFIED = "You are pre-qualified for this event.";
    static final String MSG_OPEN = "Registration is open to everyone.";
    static final String MSG_NOT_LISTED = "You are not on the qualified registrants list for this event.";
    static final String MSG_NOT_STARTED = "Registration period has not started yet.";
    static final String MSG_ENDED = "Registration period has ended.";
    static final String MSG_MISMATCH = "The distributor ID and email address do not match our records.";

    private final QualifiedRegistrantRepository qualifiedRegistrantRepository;
    private final RegistrationRepository registrationRepository;
    private final HydraDirectoryClient directoryClient;

    /**
     * @throws ValidationException   when neither e-mail nor distributor id is
     *                               given
     * @throws NotQualifiedException when the identity may not register
     */
    @Transactional(readOnly = true)
    public QualificationResult resolve(Event event, String email, String distributorId) {
        String normalizedEmail = EmailMasker.normalize(email);
        String normalizedId = distributorId != null && !distributorId.isBlank() ? distributorId.trim() : null;

        if (normalizedEmail == null && normalizedId == null) {
            throw new ValidationException("Email or distributor ID is required", List.of("email", "distributorId"));
        }

        if (!event.requiresQualification()) {
            return enrich(new QualificationResult(event.getId(), normalizedEmail, normalizedId,
                    null, null, null, false, false, QualificationSource.OPEN_REGISTRATION, MSG_OPEN));
        }

        boolean emailMasked = normalizedEmail == null;
        QualificationResult result = null;

        if (normalizedId != null) {
            result = matchByDistributorId(event, normalizedId, emailMasked);
            if (result != null && normalizedEmail != null && !normalizedEmail.equalsIgnoreCase(result.email())) {
                log.warn("Distributor ID {} claimed with a different email for event {}", normalizedId, event.getId());
                throw new NotQualifiedException(MSG_MISMATCH);
            }
        }

        if (result == null && normalizedEmail != null) {
            result = matchByEmail(event, normalizedEmail);
        }

        if (result == null) {
            log.warn("Not qualified for event {}: claim={}", event.getId(),
                    normalizedEmail != null ? EmailMasker.mask(normalizedEmail) : "distributorId:" + normalizedId);
            throw new NotQualifiedException(MSG_NOT_LISTED);
        }

        QualificationResult enriched = enrich(result);
        log.info("Qualified {} for event {} via {} (masked={})", EmailMasker.mask(enriched.email()),
                event.getId(), enriched.source(), enriched.emailMasked());
        return enriched;
    }

    private QualificationResult matchByDistributorId(Event event, String distributorId, boolean emailMasked) {
        Optional<QualifiedRegistrant> listed = qualifiedRegistrantRepository
                .findFirstByEventIdAndDistributorId(event.getId(), distributorId);
        if (listed.isPresent()) {
            checkWindow(event);
            return fromRegistrant(listed.get(), emailMasked);
        }

        Optional<Registration> registered = registrationRepository
                .findVerifiedByDistributorId(event.getId(), distributorId);
        return registered.map(r -> fromRegistration(r, emailMasked)).orElse(null);
    }

    private QualificationResult matchByEmail(Event event, String email) {
        Optional<Registration> registered = registrationRepository.findFirstByEventIdAndEmail(event.getId(), email);
        if (registered.isPresent()) {
            return fromRegistration(registered.get(), false);
        }

        Optional<QualifiedRegistrant> listed = qualifiedRegistrantRepository
                .findByEventIdAndEmailIgnoreCase(event.getId(), email);
        if (listed.isPresent()) {
            checkWindow(event);
            return fromRegistrant(listed.get(), false);
        }
        return null;
    }

    private void checkWindow(Event event) {
        if (!event.hasQualificationWindow()) {
            return;
        }
        OffsetDateTime now = OffsetDateTime.now();
        if (now.isBefore(event.getQualificationStartDate())) {
            throw new NotQualifiedException(MSG_NOT_STARTED);
        }
        if (now.isAfter(event.getQualificationEndDate())) {
            throw new NotQualifiedException(MSG_ENDED);
        }
    }

    private QualificationResult fromRegistrant(QualifiedRegistrant q, boolean emailMasked) {
        return new QualificationResult(q.getEventId(), EmailMasker.normalize(q.getEmail()), q.getDistributorId(),
                q.getFirstName(), q.getLastName(), null, emailMasked, false,
                QualificationSource.QUALIFIED_LIST, MSG_ON_LIST);
    }

    private QualificationResult fromRegistration(Registration r, boolean emailMasked) {
        return new QualificationResult(r.getEventId(), EmailMasker.normalize(r.getEmail()), r.getDistributorId(),
                r.getFirstName(), r.getLastName(), r.getPhone(), emailMasked, false,
                QualificationSource.EXISTING_REGISTRATION, MSG_PRE_QUALIFIED);
    }

    /**
     * Directory data wins over local data, which wins over nothing.
     */
    private QualificationResult enrich(QualificationResult base) {
        if (base.email() == null) {
            return base;
        }
        Optional<DirectoryProfile> directory = directoryClient.lookupByEmail(base.email());
        if (directory.isEmpty()) {
            return base;
        }
        DirectoryProfile d = directory.get();
        return new QualificationResult(base.eventId(), base.email(),
                firstNonBlank(d.unicityId(), base.distributorId()),
                firstNonBlank(d.firstName(), base.firstName()),
                firstNonBlank(d.lastName(), base.lastName()),
                firstNonBlank(d.phone(), base.phone()),
                base.emailMasked(), true, base.source(), base.message());
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
