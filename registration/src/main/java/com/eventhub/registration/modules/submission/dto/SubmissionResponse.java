package com.eventhub.registration.modules.submission.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.UUID;

@Getter
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubmissionResponse {
    private List<RegistrationView> registrations;
    private boolean wasUpdated;
    private int createdCount;
    private UUID orderId;
}
