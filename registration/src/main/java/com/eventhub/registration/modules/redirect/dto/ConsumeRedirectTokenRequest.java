package com.eventhub.registration.modules.redirect.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * {@code event} is the event id or slug the token was issued for.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ConsumeRedirectTokenRequest {

    @NotBlank(message = "token is required")
    private String token;

    @NotBlank(message = "email is required")
    @Email(message = "email must be a valid address")
    private String email;

    @NotBlank(message = "event is required")
    private String event;
}
