package com.eventhub.registration.modules.lifecycle;

import com.eventhub.registration.exception.EventNotFoundException;
import com.eventhub.registration.exception.RegistrationNotFoundException;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.Registration;
import com.eventhub.registration.model.entity.RegistrationStatus;
import com.eventhub.registration.modules.lifecycle.exception.TransferConflictException;
import com.eventhub.registration.modules.qualification.EmailMasker;
import com.eventhub.registration.modules.verification.VerificationGrantService;
import com.eventhub.registration.repository.FlightRepository;
import com.eventhub.registration.repository.GuestRepository;
import com.eventhub.registration.repository.PrintLogRepository;
import com.eventhub.registration.repository.RegistrationRepository;
import com.eventhub.registration.repository.ReimbursementRepository;
import com.eventhub.registration.repository.SwagAssignmentRepository;
import com.eventhub.registration.service.AuditService;
import com.eventhub.registration.service.EventService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Operator actions on a stored registration: transfer, cancellation and
 * check-in. None of them goes through the verification flow.
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendeeLifecycleService {

    private final RegistrationRepository registrationRepository;
    private final GuestRepository guestRepository;
    private final FlightRepository flightRepository;
    private final ReimbursementRepository reimbursementRepository;
    private final SwagAssignmentRepository swagAssignmentRepository;
    private final PrintLogRepository printLogRepository;
    private final EventService eventService;
    private final VerificationGrantService grantService;
    private final AuditService auditService;

    /**
     * Moves a registration to another event in one transaction.
     * <p>
     * Reset: check-in, badge print history and counters, swag assignments.
     * Kept: identity fields, guests, flights, reimbursements.
     * </p>
     *
     * @throws TransferConflictException same event, unknown target, or the
     *                                   identity already registered there
     */
    @Transactional
    public Registration transfer(UUID registrationId, String targetEventRef, String operator, String clientIp) {
        Registration registration = registrationRepository.findById(registrationId)
                .orElseThrow(() -> new RegistrationNotFoundException(registrationId));

        Event target;
        try {
            target = eventService.requireEvent(targetEventRef);
        } catch (EventNotFoundException e) {
            throw new TransferConflictException("Target event does not exist");
        }

        UUID sourceEventId = registration.getEventId();
        if (target.getId().equals(sourceEventId)) {
            throw new TransferConflictException("Registration already belongs to the target event");
        }

        String targetIdentityKey = target.getRegistrationMode().enforcesUniqueIdentity()
                ? EmailMasker.normalize(registration.getEmail())
                : null;
        if (targetIdentityKey != null
                && registrationRepository.findByEventIdAndIdentityKey(target.getId(), targetIdentityKey).isPresent()) {
            throw new TransferConflictException("Attendee is already registered for the target event");
        }

        int printsRemoved = printLogRepository.deleteAllByRegistrationId(registrationId);
        int swagRemoved = swagAssignmentRepository.deleteAllForRegistration(registrationId);

        registration.setEventId(target.getId());
        registration.setIdentityKey(targetIdentityKey);
        registration.setCheckedInAt(null);
        registration.setCheckedInBy(null);
        registration.setBadgePrintedAt(null);
        registration.setBadgePrintCount(0);
        registration.setSwagStatus("pending");
        if (registration.getStatus() == RegistrationStatus.CHECKED_IN) {
            registration.setStatus(RegistrationStatus.REGISTERED);
        }
        Registration saved = registrationRepository.save(registration);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fromEventId", sourceEventId.toString());
        metadata.put("toEventId", target.getId().toString());
        metadata.put("printLogsDeleted", printsRemoved);
        metadata.put("swagAssignmentsDeleted", swagRemoved);
        auditService.log(operator, "REGISTRATION_TRANSFERRED", "Registration", registrationId.toString(),
                target.getId(), clientIp, metadata);

        log.info("Registration {} transferred from event {} to event {} by {}", registrationId, sourceEventId,
                target.getId(), operator);
        return saved;
    }

    /**
     * Deletes the registration with every child row and revokes any live
     * verification grant, so the identity can register again through the
     * normal flow.
     *
     * @return deletion report (counts per child table)
     */
    @Transactional
    public Map<String, Object> cancel(UUID registrationId, String operator, String clientIp) {
        Registration registration = registrationRepository.findById(registrationId)
                .orElseThrow(() -> new RegistrationNotFoundException(registrationId));
        UUID eventId = registration.getEventId();

        Map<String, Object> report = new LinkedHashMap<>();
        // swag first: the query reaches guest-owned items through the guests table
        report.put("swagAssignmentsDeleted", swagAssignmentRepository.deleteAllForRegistration(registrationId));
        report.put("printLogsDeleted", printLogRepository.deleteAllByRegistrationId(registrationId));
        report.put("flightsDeleted", flightRepository.deleteAllByRegistrationId(registrationId));
        report.put("reimbursementsDeleted", reimbursementRepository.deleteAllByRegistrationId(registrationId));
        report.put("guestsDeleted", guestRepository.deleteAllByRegistrationId(registrationId));
        registrationRepository.delete(registration);
        report.put("registrationDeleted", true);

        grantService.revoke(eventId, registration.getEmail());

        auditService.log(operator, "REGISTRATION_CANCELLED", "Registration", registrationId.toString(), eventId,
                clientIp, report);
        log.info("Registration {} on event {} cancelled by {}", registrationId, eventId, operator);
        return report;
    }

    /**
     * Idempotent: a second check-in keeps the first timestamp.
     */
    @Transactional
    public Registration checkIn(UUID registrationId, String operator, String clientIp) {
        Registration registration = registrationRepository.findById(registrationId)
                .orElseThrow(() -> new RegistrationNotFoundException(registrationId));

        if (registration.getCheckedInAt() != null) {
            log.debug("Registration {} already checked in at {}", registrationId, registration.getCheckedInAt());
            return registration;
        }

        registration.setCheckedInAt(OffsetDateTime.now());
        registration.setCheckedInBy(operator);
        registration.setStatus(RegistrationStatus.CHECKED_IN);
        Registration saved = registrationRepository.save(registration);

        auditService.log(operator, "REGISTRATION_CHECKED_IN", "Registration", registrationId.toString(),
                registration.getEventId(), clientIp, null);
        log.info("Registration {} checked in by {}", registrationId, operator);
        return saved;
    }
}
