package com.eventhub.registration.modules.verification.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Result of issuing a code. The plain address is never part of it: callers
 * that only sent a distributor id get the masked form for display and continue
 * with the session token.
 */
@Getter
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IssueCodeResponse {
    private String sessionToken;
    private boolean emailMasked;
    private String maskedEmail;
    private long expiresInSeconds;
}
