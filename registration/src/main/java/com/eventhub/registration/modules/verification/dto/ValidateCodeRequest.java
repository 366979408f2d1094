package com.eventhub.registration.modules.verification.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Either {@code email} or {@code sessionToken} identifies the session.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ValidateCodeRequest {

    @Email(message = "email must be a valid address")
    private String email;

    private String sessionToken;

    @NotBlank(message = "code is required")
    @Pattern(regexp = "\\d{4,10}", message = "code must be numeric")
    private String code;
}
