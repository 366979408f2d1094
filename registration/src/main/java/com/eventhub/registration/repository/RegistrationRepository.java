package com.eventhub.registration.repository;

import com.eventhub.registration.model.entity.Registration;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface RegistrationRepository extends JpaRepository<Registration, UUID> {

    /**
     * Lookup by the uniqueness key of the verified modes. Takes a row lock so a
     * concurrent update of the same identity waits for this transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Registration r WHERE r.eventId = :eventId AND r.identityKey = :identityKey")
    Optional<Registration> findForUpdate(UUID eventId, String identityKey);

    Optional<Registration> findByEventIdAndIdentityKey(UUID eventId, String identityKey);

    @Query("SELECT r FROM Registration r " +
            "WHERE r.eventId = :eventId AND r.distributorId = :distributorId AND r.identityKey IS NOT NULL " +
            "ORDER BY r.createdAt ASC LIMIT 1")
    Optional<Registration> findVerifiedByDistributorId(UUID eventId, String distributorId);

    @Query("SELECT r FROM Registration r " +
            "WHERE r.eventId = :eventId AND LOWER(r.email) = LOWER(:email) " +
            "ORDER BY r.createdAt ASC LIMIT 1")
    Optional<Registration> findFirstByEventIdAndEmail(UUID eventId, String email);

    /**
     * Admin- or import-created row for the same address that no verified
     * submission has claimed yet. Locked like {@link #findForUpdate}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Registration r " +
            "WHERE r.eventId = :eventId AND r.identityKey IS NULL AND LOWER(r.email) = LOWER(:email) " +
            "ORDER BY r.createdAt ASC LIMIT 1")
    Optional<Registration> findUnclaimedByEmailForUpdate(UUID eventId, String email);
}
