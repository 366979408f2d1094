package com.eventhub.registration.repository;

import com.eventhub.registration.model.entity.Flight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FlightRepository extends JpaRepository<Flight, UUID> {

    List<Flight> findAllByRegistrationId(UUID registrationId);

    @Modifying
    @Query("DELETE FROM Flight x WHERE x.registrationId = :registrationId")
    int deleteAllByRegistrationId(UUID registrationId);
}
