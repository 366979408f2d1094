package com.eventhub.registration.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "flights")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Flight {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "registration_id", nullable = false)
    private UUID registrationId;

    /** "arrival" or "departure". */
    @Column(name = "type", length = 20)
    private String type;

    @Column(name = "airline", length = 100)
    private String airline;

    @Column(name = "flight_number", length = 20)
    private String flightNumber;

    @Column(name = "departure_city", length = 100)
    private String departureCity;

    @Column(name = "arrival_city", length = 100)
    private String arrivalCity;

    @Column(name = "departure_time")
    private OffsetDateTime departureTime;

    @Column(name = "arrival_time")
    private OffsetDateTime arrivalTime;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
    }
}
