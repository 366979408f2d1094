package com.eventhub.registration.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Swag item handed to (or reserved for) an attendee at one event.
 */
@Entity
@Table(name = "swag_assignments")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SwagAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "swag_item_id", nullable = false)
    private UUID swagItemId;

    @Column(name = "registration_id")
    private UUID registrationId;

    @Column(name = "guest_id")
    private UUID guestId;

    @Column(name = "size", length = 10)
    private String size;

    /** "assigned" or "received". */
    @Column(name = "status", length = 20)
    private String status;

    @Column(name = "received_at")
    private OffsetDateTime receivedAt;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
        if (status == null)
            status = "assigned";
    }
}
