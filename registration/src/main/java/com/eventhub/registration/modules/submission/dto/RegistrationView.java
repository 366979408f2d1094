package com.eventhub.registration.modules.submission.dto;

import com.eventhub.registration.model.entity.Registration;
import com.eventhub.registration.model.entity.RegistrationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A registration as returned to its own registrant.
 */
@Getter
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegistrationView {
    private UUID id;
    private UUID eventId;
    private String email;
    private String firstName;
    private String lastName;
    private String distributorId;
    private String phone;
    private RegistrationStatus status;
    private String language;
    private String gender;
    private LocalDate dateOfBirth;
    private String passportNumber;
    private String passportCountry;
    private LocalDate passportExpiration;
    private String emergencyContact;
    private String emergencyContactPhone;
    private String shirtSize;
    private String pantSize;
    private String dietaryRestrictions;
    private Boolean adaAccommodations;
    private String roomType;
    private Boolean termsAccepted;
    private String swagStatus;
    private Boolean verifiedByHydra;
    private Map<String, Object> customFields;
    private UUID orderId;
    private Integer attendeeIndex;
    private OffsetDateTime registeredAt;
    private OffsetDateTime checkedInAt;
    private OffsetDateTime lastModified;

    public static RegistrationView from(Registration r, Map<String, Object> customFields) {
        return RegistrationView.builder()
                .id(r.getId())
                .eventId(r.getEventId())
                .email(r.getEmail())
                .firstName(r.getFirstName())
                .lastName(r.getLastName())
                .distributorId(r.getDistributorId())
                .phone(r.getPhone())
                .status(r.getStatus())
                .language(r.getLanguage())
                .gender(r.getGender())
                .dateOfBirth(r.getDateOfBirth())
                .passportNumber(r.getPassportNumber())
                .passportCountry(r.getPassportCountry())
                .passportExpiration(r.getPassportExpiration())
                .emergencyContact(r.getEmergencyContact())
                .emergencyContactPhone(r.getEmergencyContactPhone())
                .shirtSize(r.getShirtSize())
                .pantSize(r.getPantSize())
                .dietaryRestrictions(r.getDietaryRestrictions())
                .adaAccommodations(r.getAdaAccommodations())
                .roomType(r.getRoomType())
                .termsAccepted(r.getTermsAccepted())
                .swagStatus(r.getSwagStatus())
                .verifiedByHydra(r.getVerifiedByHydra())
                .customFields(customFields.isEmpty() ? null : customFields)
                .orderId(r.getOrderId())
                .attendeeIndex(r.getAttendeeIndex())
                .registeredAt(r.getRegisteredAt())
                .checkedInAt(r.getCheckedInAt())
                .lastModified(r.getLastModified())
                .build();
    }
}
