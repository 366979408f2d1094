package com.eventhub.registration.modules.submission;

import com.eventhub.registration.exception.ValidationException;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.Registration;
import com.eventhub.registration.model.entity.RegistrationMode;
import com.eventhub.registration.modules.qualification.EmailMasker;
import com.eventhub.registration.modules.qualification.QualificationResolver;
import com.eventhub.registration.modules.submission.dto.RegistrationForm;
import com.eventhub.registration.modules.submission.dto.SubmitRegistrationRequest;
import com.eventhub.registration.modules.verification.VerificationGrantService;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.repository.RegistrationRepository;
import com.eventhub.registration.service.AuditService;
import com.eventhub.registration.service.EventService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reconciles a submission against what is already stored for the identity.
 * <p>
 * Checks run in a fixed order and the first failure wins:
 * </p>
 * <ol>
 * <li>event closed or not published</li>
 * <li>verified modes: live verification grant for the form's e-mail</li>
 * <li>qualified mode: the identity still qualifies</li>
 * <li>required fields</li>
 * </ol>
 * <p>
 * Verified modes upsert on (event, e-mail); anonymous events always insert,
 * one row per attendee of the order.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationSubmissionService {

    private final EventService eventService;
    private final VerificationGrantService grantService;
    private final QualificationResolver qualificationResolver;
    private final RequiredFieldSchema requiredFieldSchema;
    private final RegistrationWriter registrationWriter;
    private final RegistrationRepository registrationRepository;
    private final AuditService auditService;

    public SubmissionResult submit(Event event, SubmitRegistrationRequest request, String clientIp) {
        eventService.assertOpen(event);

        if (request == null || request.getForm() == null) {
            throw new ValidationException("Registration form is required", List.of("form"));
        }

        if (event.getRegistrationMode() == RegistrationMode.OPEN_ANONYMOUS) {
            return submitAnonymous(event, request, clientIp);
        }
        return submitVerified(event, request, clientIp);
    }

    /**
     * Returns the caller's own registration for prefilling. Verified modes need
     * a live grant; anonymous events never reveal stored data.
     */
    public Optional<Registration> fetchExisting(Event event, String email, String grantToken) {
        if (!event.getRegistrationMode().requiresVerification()) {
            return Optional.empty();
        }
        String identityKey = EmailMasker.normalize(email);
        if (identityKey == null) {
            throw new ValidationException("Email is required", List.of("email"));
        }

        VerifiedProfile grant = grantService.require(event.getId(), identityKey, grantToken);

        Optional<Registration> existing = registrationRepository.findByEventIdAndIdentityKey(event.getId(),
                identityKey);
        if (existing.isEmpty() && grant.getUnicityId() != null && !grant.getUnicityId().isBlank()) {
            existing = registrationRepository.findVerifiedByDistributorId(event.getId(), grant.getUnicityId());
        }
        log.debug("Existing registration lookup for {} on event {}: {}", EmailMasker.mask(identityKey),
                event.getId(), existing.isPresent() ? "found" : "none");
        return existing;
    }

    private SubmissionResult submitVerified(Event event, SubmitRegistrationRequest request, String clientIp) {
        RegistrationForm form = request.getForm();

        if (request.getAdditionalAttendees() != null && !request.getAdditionalAttendees().isEmpty()) {
            throw new ValidationException("Additional attendees are only accepted for open registration events",
                    List.of("additionalAttendees"));
        }

        String identityKey = EmailMasker.normalize(form.getEmail());
        if (identityKey == null) {
            throw new ValidationException("Email is required", List.of("email"));
        }

        VerifiedProfile grant = grantService.require(event.getId(), identityKey, request.getGrantToken());

        if (event.requiresQualification()) {
            qualificationResolver.resolve(event, identityKey, null);
        }

        List<String> missing = requiredFieldSchema.missingFields(form, event.getRequiredFields());
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing required fields: " + String.join(", ", missing), missing);
        }

        RegistrationWriter.WriteResult written;
        try {
            written = registrationWriter.upsertVerified(event, identityKey, form, grant,
                    request.getExistingRegistrationId(), clientIp);
        } catch (DataIntegrityViolationException race) {
            log.info("Concurrent registration for {} on event {}, retrying as update",
                    EmailMasker.mask(identityKey), event.getId());
            written = registrationWriter.upsertVerified(event, identityKey, form, grant,
                    request.getExistingRegistrationId(), clientIp);
        }

        Registration registration = written.registration();
        auditService.log(EmailMasker.mask(identityKey),
                written.updated() ? "REGISTRATION_UPDATED" : "REGISTRATION_CREATED",
                "Registration", String.valueOf(registration.getId()), event.getId(), clientIp,
                Map.of("mode", event.getRegistrationMode().value()));
        log.info("Registration {} {} for {} on event {}", registration.getId(),
                written.updated() ? "updated" : "created", EmailMasker.mask(identityKey), event.getId());

        return new SubmissionResult(List.of(registration), written.updated(), null);
    }

    private SubmissionResult submitAnonymous(Event event, SubmitRegistrationRequest request, String clientIp) {
        List<RegistrationForm> attendees = new ArrayList<>();
        attendees.add(request.getForm());
        if (request.getAdditionalAttendees() != null) {
            attendees.addAll(request.getAdditionalAttendees());
        }

        List<String> missing = new ArrayList<>(
                requiredFieldSchema.missingFields(request.getForm(), event.getRequiredFields()));
        for (int i = 1; i < attendees.size(); i++) {
            RegistrationForm attendee = attendees.get(i);
            if (attendee == null) {
                missing.add("additionalAttendees[" + (i - 1) + "]");
                continue;
            }
            for (String field : requiredFieldSchema.missingAttendeeFields(attendee)) {
                missing.add("additionalAttendees[" + (i - 1) + "]." + field);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing required fields: " + String.join(", ", missing), missing);
        }

        UUID orderId = UUID.randomUUID();
        List<Registration> rows = registrationWriter.insertOrder(event, attendees, orderId, clientIp);

        auditService.log(AuditService.SYSTEM_ACTOR, "REGISTRATION_ORDER_CREATED", "Registration",
                orderId.toString(), event.getId(), clientIp, Map.of("attendees", rows.size()));
        log.info("Anonymous order {} created {} registration(s) on event {}", orderId, rows.size(), event.getId());

        return new SubmissionResult(rows, false, orderId);
    }
}
