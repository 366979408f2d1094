package com.eventhub.registration.service;

import com.eventhub.registration.model.entity.AuditLog;
import com.eventhub.registration.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Service for recording audit trail entries.
 * Called from every sensitive operation (code issued / validated, token
 * consumed, registration written, transfer, cancellation, check-in).
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    public static final String SYSTEM_ACTOR = "system";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Record an audit log entry.
     *
     * @param actor      masked registrant e-mail, operator name or "system"
     * @param action     short action descriptor, e.g. "CODE_ISSUED",
     *                   "REGISTRATION_TRANSFERRED"
     * @param entityType the type of entity affected, e.g. "Registration"
     * @param entityId   the ID of the affected entity (nullable)
     * @param eventId    the event the action belongs to (nullable)
     * @param ip         client IP address (nullable)
     * @param metadata   arbitrary key-value metadata (serialized as JSONB)
     */
    public void log(String actor, String action, String entityType, String entityId,
            UUID eventId, String ip, Map<String, Object> metadata) {
        String event = eventId != null ? eventId.toString() : null;
        try {
            AuditLog entry = AuditLog.builder()
                    .actor(actor)
                    .action(action)
                    .entityType(entityType)
                    .entityId(entityId)
                    .eventId(event)
                    .ipAddress(ip)
                    .metadata(metadata != null ? objectMapper.writeValueAsString(metadata) : null)
                    .build();

            auditLogRepository.save(entry);
            log.debug("Audit logged: action={}, entity={}:{}, actor={}", action, entityType, entityId, actor);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit metadata for action={}: {}", action, e.getMessage());
            // Still save without metadata rather than losing the audit entry
            AuditLog entry = AuditLog.builder()
                    .actor(actor)
                    .action(action)
                    .entityType(entityType)
                    .entityId(entityId)
                    .eventId(event)
                    .ipAddress(ip)
                    .build();
            auditLogRepository.save(entry);
        }
    }
}
