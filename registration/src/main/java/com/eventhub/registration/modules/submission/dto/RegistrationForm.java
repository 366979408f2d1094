package com.eventhub.registration.modules.submission.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Attendee form payload. {@code null} means "not submitted": on update the
 * stored value is kept. Event-specific fields go in {@code customFields}.
 */
@Getter
@Setter
@NoArgsConstructor
public class RegistrationForm {

    @Size(max = 100)
    private String firstName;

    @Size(max = 100)
    private String lastName;

    @Email(message = "email must be a valid address")
    @Size(max = 320)
    private String email;

    @Size(max = 30)
    private String phone;

    @Size(max = 64)
    private String distributorId;

    @Size(max = 5)
    private String language;

    private String gender;
    private LocalDate dateOfBirth;

    private String passportNumber;
    private String passportCountry;
    private LocalDate passportExpiration;

    private String emergencyContact;
    private String emergencyContactPhone;

    private String shirtSize;
    private String pantSize;
    private String dietaryRestrictions;
    private Boolean adaAccommodations;
    private String roomType;
    private Boolean termsAccepted;

    private Map<String, Object> customFields = new HashMap<>();
}
