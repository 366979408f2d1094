package com.eventhub.registration.repository;

import com.eventhub.registration.model.entity.SwagAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface SwagAssignmentRepository extends JpaRepository<SwagAssignment, UUID> {

    long countByRegistrationId(UUID registrationId);

    /** Covers the registrant's own items and the items of their guests. */
    @Modifying
    @Query("DELETE FROM SwagAssignment s WHERE s.registrationId = :registrationId " +
            "OR s.guestId IN (SELECT g.id FROM Guest g WHERE g.registrationId = :registrationId)")
    int deleteAllForRegistration(UUID registrationId);
}
