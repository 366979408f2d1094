package com.eventhub.registration.modules.qualification.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Claimed identity. At least one of the two must be present.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class QualificationRequest {

    @Email(message = "email must be a valid address")
    @Size(max = 320)
    private String email;

    @Size(max = 64)
    private String distributorId;
}
