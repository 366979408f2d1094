package com.eventhub.registration.modules.verification.dto;

import com.eventhub.registration.modules.qualification.QualificationSource;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Identity that has proven control of its e-mail for one event, through a
 * code, a redirect token or a signed link. Also the payload carried by
 * redirect tokens and verification grants.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerifiedProfile {
    private UUID eventId;
    private String email;
    private String unicityId;
    private String firstName;
    private String lastName;
    private String phone;
    private boolean verifiedByHydra;
    private QualificationSource qualificationSource;
    /** Present right after code validation only. */
    private String redirectToken;
    /**
     * Bearer proof of this grant. Submit, existing-registration lookup and
     * redirect-token issue must present it along with the e-mail.
     */
    private String grantToken;
    private Instant verifiedUntil;
}
