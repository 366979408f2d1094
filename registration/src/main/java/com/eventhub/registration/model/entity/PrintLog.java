package com.eventhub.registration.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One badge print request for a registration.
 */
@Entity
@Table(name = "print_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrintLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "registration_id", nullable = false)
    private UUID registrationId;

    @Column(name = "guest_id")
    private UUID guestId;

    @Column(name = "printer_id")
    private UUID printerId;

    @Column(name = "status", length = 20)
    private String status;

    @Column(name = "requested_by")
    private String requestedBy;

    @Column(name = "requested_at", updatable = false)
    private OffsetDateTime requestedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @PrePersist
    protected void onCreate() {
        if (requestedAt == null)
            requestedAt = OffsetDateTime.now();
        if (status == null)
            status = "pending";
    }
}
