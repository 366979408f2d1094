package com.eventhub.registration.modules.qualification.dto;

import com.eventhub.registration.modules.qualification.QualificationSource;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.UUID;

/**
 * Caller-safe qualification result. {@code email} is masked whenever
 * {@code emailMasked} is true.
 */
@Getter
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QualifiedProfile {
    private UUID eventId;
    private boolean qualified;
    private String email;
    private boolean emailMasked;
    private String unicityId;
    private String firstName;
    private String lastName;
    private String phone;
    private QualificationSource source;
    private String message;
}
