package com.eventhub.registration.modules.qualification;

import com.eventhub.registration.modules.qualification.dto.QualifiedProfile;

import java.util.UUID;

/**
 * Server-side outcome of a qualification lookup. Holds the real e-mail, so it
 * is never serialized to a caller directly; {@link #toPublicProfile()} gives the
 * caller-safe view.
 *
 * @param emailMasked true when the caller only supplied a distributor id and
 *                    has not proven ownership of the address
 */
public record QualificationResult(
        UUID eventId,
        String email,
        String distributorId,
        String firstName,
        String lastName,
        String phone,
        boolean emailMasked,
        boolean verifiedByHydra,
        QualificationSource source,
        String message) {

    public QualifiedProfile toPublicProfile() {
        return QualifiedProfile.builder()
                .eventId(eventId)
                .qualified(true)
                .email(emailMasked ? EmailMasker.mask(email) : email)
                .emailMasked(emailMasked)
                .unicityId(distributorId)
                .firstName(firstName)
                .lastName(lastName)
                .phone(emailMasked ? null : phone)
                .source(source)
                .message(message)
                .build();
    }
}
