package com.eventhub.registration.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "events")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "slug", unique = true)
    private String slug;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private EventStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "registration_mode", length = 30, nullable = false)
    private RegistrationMode registrationMode;

    /** Once set, no further submissions of any kind are accepted. */
    @Column(name = "registration_closed_at")
    private OffsetDateTime registrationClosedAt;

    @Column(name = "qualification_start_date")
    private OffsetDateTime qualificationStartDate;

    @Column(name = "qualification_end_date")
    private OffsetDateTime qualificationEndDate;

    @Column(name = "capacity")
    private Integer capacity;

    /**
     * Admin-configured field ids the registration form must carry, on top of
     * first name, last name and email.
     */
    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "event_required_fields", joinColumns = @JoinColumn(name = "event_id"))
    @Column(name = "field_id", length = 64)
    private Set<String> requiredFields = new HashSet<>();

    @Column(name = "default_language", length = 5)
    private String defaultLanguage;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "last_modified")
    private OffsetDateTime lastModified;

    public boolean requiresQualification() {
        return registrationMode != null && registrationMode.requiresQualification();
    }

    public boolean isRegistrationClosed() {
        return registrationClosedAt != null;
    }

    public boolean hasQualificationWindow() {
        return qualificationStartDate != null && qualificationEndDate != null;
    }

    @PrePersist
    protected void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null)
            createdAt = now;
        if (lastModified == null)
            lastModified = now;
        if (status == null)
            status = EventStatus.DRAFT;
        if (registrationMode == null)
            registrationMode = RegistrationMode.OPEN_VERIFIED;
        if (defaultLanguage == null)
            defaultLanguage = "en";
    }

    @PreUpdate
    protected void onUpdate() {
        lastModified = OffsetDateTime.now();
    }
}
