package com.eventhub.registration.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One attendee's registration for one event.
 * <p>
 * {@code identityKey} holds the normalized email for events that enforce one
 * registration per identity and is {@code null} for anonymous registrations, so
 * the {@code (event_id, identity_key)} unique constraint only binds the
 * verified modes.
 * </p>
 */
@Entity
@Table(name = "registrations", uniqueConstraints = @UniqueConstraint(name = "uq_registrations_event_identity", columnNames = {
        "event_id", "identity_key" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Registration {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Column(name = "identity_key")
    private String identityKey;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name", nullable = false)
    private String lastName;

    @Column(name = "distributor_id", length = 64)
    private String distributorId;

    @Column(name = "phone", length = 30)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private RegistrationStatus status;

    @Column(name = "language", length = 5)
    private String language;

    @Column(name = "gender", length = 20)
    private String gender;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Column(name = "passport_number", length = 64)
    private String passportNumber;

    @Column(name = "passport_country", length = 64)
    private String passportCountry;

    @Column(name = "passport_expiration")
    private LocalDate passportExpiration;

    @Column(name = "emergency_contact")
    private String emergencyContact;

    @Column(name = "emergency_contact_phone", length = 30)
    private String emergencyContactPhone;

    @Column(name = "shirt_size", length = 10)
    private String shirtSize;

    @Column(name = "pant_size", length = 10)
    private String pantSize;

    @Column(name = "dietary_restrictions", columnDefinition = "TEXT")
    private String dietaryRestrictions;

    @Column(name = "ada_accommodations")
    private Boolean adaAccommodations;

    @Column(name = "ada_accommodations_at")
    private OffsetDateTime adaAccommodationsAt;

    @Column(name = "ada_accommodations_ip")
    private String adaAccommodationsIp;

    @Column(name = "room_type", length = 30)
    private String roomType;

    /** Event-specific custom fields, stored as raw JSON. */
    @Column(name = "form_data", columnDefinition = "JSONB")
    private String formData;

    @Column(name = "terms_accepted")
    private Boolean termsAccepted;

    @Column(name = "terms_accepted_at")
    private OffsetDateTime termsAcceptedAt;

    @Column(name = "terms_accepted_ip")
    private String termsAcceptedIp;

    @Column(name = "swag_status", length = 20)
    private String swagStatus;

    @Column(name = "checked_in_at")
    private OffsetDateTime checkedInAt;

    @Column(name = "checked_in_by")
    private String checkedInBy;

    @Column(name = "badge_printed_at")
    private OffsetDateTime badgePrintedAt;

    @Column(name = "badge_print_count")
    private Integer badgePrintCount;

    /** True when the identity was confirmed by the external directory. */
    @Column(name = "verified_by_hydra")
    private Boolean verifiedByHydra;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    /** Groups the attendees of one anonymous multi-ticket submission. */
    @Column(name = "order_id")
    private UUID orderId;

    @Column(name = "attendee_index")
    private Integer attendeeIndex;

    @Column(name = "registered_at")
    private OffsetDateTime registeredAt;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "last_modified")
    private OffsetDateTime lastModified;

    @PrePersist
    protected void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null)
            createdAt = now;
        if (lastModified == null)
            lastModified = now;
        if (status == null)
            status = RegistrationStatus.REGISTERED;
        if (swagStatus == null)
            swagStatus = "pending";
        if (badgePrintCount == null)
            badgePrintCount = 0;
        if (verifiedByHydra == null)
            verifiedByHydra = false;
    }

    @PreUpdate
    protected void onUpdate() {
        lastModified = OffsetDateTime.now();
    }
}
