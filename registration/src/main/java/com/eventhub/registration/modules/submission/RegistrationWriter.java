package com.eventhub.registration.modules.submission;

import com.eventhub.registration.exception.RegistrationNotFoundException;
import com.eventhub.registration.model.entity.Event;
import com.eventhub.registration.model.entity.Registration;
import com.eventhub.registration.model.entity.RegistrationStatus;
import com.eventhub.registration.modules.qualification.EmailMasker;
import com.eventhub.registration.modules.submission.dto.RegistrationForm;
import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import com.eventhub.registration.repository.RegistrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Transactional writes behind {@link RegistrationSubmissionService}.
 * <p>
 * Field precedence on update is last-writer-wins per submission: every non-null
 * form value replaces the stored one, values the form leaves out are kept.
 * Custom fields merge key by key with the submitted keys winning.
 * </p>
 */
@SuppressWarnings("null")
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistrationWriter {

    private final RegistrationRepository registrationRepository;
    private final FormDataMapper formDataMapper;

    public record WriteResult(Registration registration, boolean updated) {
    }

    /**
     * Insert-or-update keyed by (event, identity). A concurrent insert of the
     * same identity surfaces as a DataIntegrityViolationException from the
     * unique constraint; the caller retries, and the retry takes the update
     * path.
     */
    @Transactional
    public WriteResult upsertVerified(Event event, String identityKey, RegistrationForm form,
            VerifiedProfile grant, UUID existingRegistrationId, String clientIp) {
        OffsetDateTime now = OffsetDateTime.now();
        Optional<Registration> existing = findExisting(event, identityKey, grant, existingRegistrationId);

        if (existing.isPresent()) {
            Registration registration = existing.get();
            applyForm(registration, form, clientIp, now);
            registration.setIdentityKey(identityKey);
            registration.setEmail(identityKey);
            if (registration.getDistributorId() == null) {
                registration.setDistributorId(grant.getUnicityId());
            }
            if (grant.isVerifiedByHydra()) {
                registration.setVerifiedByHydra(true);
            }
            if (registration.getStatus() == RegistrationStatus.QUALIFIED
                    || registration.getStatus() == RegistrationStatus.NOT_COMING) {
                registration.setStatus(RegistrationStatus.REGISTERED);
            }
            if (registration.getRegisteredAt() == null) {
                registration.setRegisteredAt(now);
            }
            return new WriteResult(registrationRepository.save(registration), true);
        }

        Registration registration = Registration.builder()
                .eventId(event.getId())
                .identityKey(identityKey)
                .email(identityKey)
                .distributorId(grant.getUnicityId())
                .firstName(grant.getFirstName())
                .lastName(grant.getLastName())
                .phone(grant.getPhone())
                .language(event.getDefaultLanguage())
                .status(RegistrationStatus.REGISTERED)
                .verifiedByHydra(grant.isVerifiedByHydra())
                .registeredAt(now)
                .build();
        applyForm(registration, form, clientIp, now);
        registration.setEmail(identityKey);

        return new WriteResult(registrationRepository.saveAndFlush(registration), false);
    }

    /**
     * Writes every attendee of an anonymous order or none of them.
     */
    @Transactional
    public List<Registration> insertOrder(Event event, List<RegistrationForm> attendees, UUID orderId,
            String clientIp) {
        OffsetDateTime now = OffsetDateTime.now();
        String sharedLanguage = attendees.get(0).getLanguage() != null
                ? attendees.get(0).getLanguage()
                : event.getDefaultLanguage();

        List<Registration> rows = new ArrayList<>();
        for (int i = 0; i < attendees.size(); i++) {
            Registration registration = Registration.builder()
                    .eventId(event.getId())
                    .status(RegistrationStatus.REGISTERED)
                    .language(sharedLanguage)
                    .verifiedByHydra(false)
                    .orderId(orderId)
                    .attendeeIndex(i)
                    .registeredAt(now)
                    .build();
            applyForm(registration, attendees.get(i), clientIp, now);
            registration.setEmail(EmailMasker.normalize(registration.getEmail()));
            rows.add(registration);
        }
        return registrationRepository.saveAll(rows);
    }

    private Optional<Registration> findExisting(Event event, String identityKey, VerifiedProfile grant,
            UUID existingRegistrationId) {
        if (existingRegistrationId != null) {
            Registration byId = registrationRepository.findById(existingRegistrationId)
                    .filter(r -> event.getId().equals(r.getEventId()))
                    .filter(r -> identityKey.equals(r.getIdentityKey())
                            || (r.getIdentityKey() == null && identityKey.equalsIgnoreCase(r.getEmail())))
                    .orElseThrow(() -> new RegistrationNotFoundException(existingRegistrationId));
            return Optional.of(byId);
        }

        Optional<Registration> byIdentity = registrationRepository.findForUpdate(event.getId(), identityKey);
        if (byIdentity.isPresent()) {
            return byIdentity;
        }
        if (grant.getUnicityId() != null && !grant.getUnicityId().isBlank()) {
            Optional<Registration> byDistributor =
                    registrationRepository.findVerifiedByDistributorId(event.getId(), grant.getUnicityId());
            if (byDistributor.isPresent()) {
                return byDistributor;
            }
        }
        // imported rows carry no identity key until their owner first submits
        Optional<Registration> unclaimed =
                registrationRepository.findUnclaimedByEmailForUpdate(event.getId(), identityKey);
        unclaimed.ifPresent(r -> log.info("Claiming imported registration {} for event {}", r.getId(), event.getId()));
        return unclaimed;
    }

    private void applyForm(Registration r, RegistrationForm form, String clientIp, OffsetDateTime now) {
        setIfPresent(form.getFirstName(), v -> r.setFirstName(v.trim()));
        setIfPresent(form.getLastName(), v -> r.setLastName(v.trim()));
        setIfPresent(form.getEmail(), r::setEmail);
        setIfPresent(form.getPhone(), r::setPhone);
        setIfPresent(form.getDistributorId(), v -> r.setDistributorId(v.trim()));
        setIfPresent(form.getLanguage(), r::setLanguage);
        setIfPresent(form.getGender(), r::setGender);
        setIfPresent(form.getDateOfBirth(), r::setDateOfBirth);
        setIfPresent(form.getPassportNumber(), r::setPassportNumber);
        setIfPresent(form.getPassportCountry(), r::setPassportCountry);
        setIfPresent(form.getPassportExpiration(), r::setPassportExpiration);
        setIfPresent(form.getEmergencyContact(), r::setEmergencyContact);
        setIfPresent(form.getEmergencyContactPhone(), r::setEmergencyContactPhone);
        setIfPresent(form.getShirtSize(), r::setShirtSize);
        setIfPresent(form.getPantSize(), r::setPantSize);
        setIfPresent(form.getDietaryRestrictions(), r::setDietaryRestrictions);
        setIfPresent(form.getRoomType(), r::setRoomType);

        if (form.getTermsAccepted() != null) {
            if (form.getTermsAccepted() && !Boolean.TRUE.equals(r.getTermsAccepted())) {
                r.setTermsAcceptedAt(now);
                r.setTermsAcceptedIp(clientIp);
            }
            r.setTermsAccepted(form.getTermsAccepted());
        }
        if (form.getAdaAccommodations() != null) {
            if (form.getAdaAccommodations() && !Boolean.TRUE.equals(r.getAdaAccommodations())) {
                r.setAdaAccommodationsAt(now);
                r.setAdaAccommodationsIp(clientIp);
            }
            r.setAdaAccommodations(form.getAdaAccommodations());
        }

        if (form.getCustomFields() != null && !form.getCustomFields().isEmpty()) {
            r.setFormData(formDataMapper.merge(r.getFormData(), form.getCustomFields()));
        }
    }

    private static <T> void setIfPresent(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
