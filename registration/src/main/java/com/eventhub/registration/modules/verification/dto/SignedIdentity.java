package com.eventhub.registration.modules.verification.dto;

import java.time.Instant;
import java.util.UUID;

/**
 * Identity asserted by a signed link.
 */
public record SignedIdentity(UUID eventId, String email, String distributorId, Instant expiresAt) {
}
