package com.eventhub.registration.modules.submission.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One submission. {@code additionalAttendees} is only accepted by anonymous
 * events (multi-ticket orders).
 */
@Getter
@Setter
@NoArgsConstructor
public class SubmitRegistrationRequest {

    @Valid
    @NotNull(message = "form is required")
    private RegistrationForm form;

    @Valid
    @Size(max = 20, message = "at most 20 additional attendees per order")
    private List<RegistrationForm> additionalAttendees = new ArrayList<>();

    private UUID existingRegistrationId;

    /** Required by the verified modes; returned by code validation. */
    private String grantToken;
}
