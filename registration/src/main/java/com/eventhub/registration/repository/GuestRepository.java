package com.eventhub.registration.repository;

import com.eventhub.registration.model.entity.Guest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface GuestRepository extends JpaRepository<Guest, UUID> {

    List<Guest> findAllByRegistrationId(UUID registrationId);

    @Modifying
    @Query("DELETE FROM Guest x WHERE x.registrationId = :registrationId")
    int deleteAllByRegistrationId(UUID registrationId);
}
