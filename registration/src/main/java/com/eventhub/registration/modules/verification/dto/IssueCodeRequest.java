package com.eventhub.registration.modules.verification.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class IssueCodeRequest {

    @Email(message = "email must be a valid address")
    @Size(max = 320)
    private String email;

    @Size(max = 64)
    private String distributorId;
}
