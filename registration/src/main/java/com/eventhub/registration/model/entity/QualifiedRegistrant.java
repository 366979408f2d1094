package com.eventhub.registration.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "qualified_registrants")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QualifiedRegistrant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name", nullable = false)
    private String lastName;

    /** External distributor id (the directory's "unicity id"). */
    @Column(name = "distributor_id", length = 64)
    private String distributorId;

    @Column(name = "guest_allowance_rule_id")
    private UUID guestAllowanceRuleId;

    @Column(name = "imported_at")
    private OffsetDateTime importedAt;

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
        if (importedAt == null)
            importedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        lastModified = OffsetDateTime.now();
    }
}
