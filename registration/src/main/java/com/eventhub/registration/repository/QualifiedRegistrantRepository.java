package com.eventhub.registration.repository;

import com.eventhub.registration.model.entity.QualifiedRegistrant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface QualifiedRegistrantRepository extends JpaRepository<QualifiedRegistrant, UUID> {

    Optional<QualifiedRegistrant> findFirstByEventIdAndDistributorId(UUID eventId, String distributorId);

    @Query("SELECT q FROM QualifiedRegistrant q " +
            "WHERE q.eventId = :eventId AND LOWER(q.email) = LOWER(:email) " +
            "ORDER BY q.createdAt ASC LIMIT 1")
    Optional<QualifiedRegistrant> findByEventIdAndEmailIgnoreCase(UUID eventId, String email);
}
