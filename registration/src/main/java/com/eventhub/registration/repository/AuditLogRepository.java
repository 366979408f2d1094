package com.eventhub.registration.repository;

import com.eventhub.registration.model.entity.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findAllByEntityIdOrderByCreatedAtAsc(String entityId);
}
