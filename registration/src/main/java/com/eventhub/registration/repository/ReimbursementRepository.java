package com.eventhub.registration.repository;

import com.eventhub.registration.model.entity.Reimbursement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReimbursementRepository extends JpaRepository<Reimbursement, UUID> {

    List<Reimbursement> findAllByRegistrationId(UUID registrationId);

    @Modifying
    @Query("DELETE FROM Reimbursement x WHERE x.registrationId = :registrationId")
    int deleteAllByRegistrationId(UUID registrationId);
}
