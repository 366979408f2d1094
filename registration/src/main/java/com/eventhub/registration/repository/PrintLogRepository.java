package com.eventhub.registration.repository;

import com.eventhub.registration.model.entity.PrintLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PrintLogRepository extends JpaRepository<PrintLog, UUID> {

    long countByRegistrationId(UUID registrationId);

    @Modifying
    @Query("DELETE FROM PrintLog p WHERE p.registrationId = :registrationId")
    int deleteAllByRegistrationId(UUID registrationId);
}
