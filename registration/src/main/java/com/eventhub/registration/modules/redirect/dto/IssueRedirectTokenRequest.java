package com.eventhub.registration.modules.redirect.dto;

import com.eventhub.registration.modules.verification.dto.VerifiedProfile;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class IssueRedirectTokenRequest {

    @NotBlank(message = "email is required")
    @Email(message = "email must be a valid address")
    private String email;

    @NotBlank(message = "grantToken is required")
    private String grantToken;

    private VerifiedProfile profile;
}
