package com.eventhub.registration.model.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trust model an event registers attendees under.
 * <ul>
 * <li>{@code qualified_verified}: identity must be on the qualified list and
 * prove control of its email</li>
 * <li>{@code open_verified}: anyone may register, but must prove control of
 * their email before the submission is accepted</li>
 * <li>{@code open_anonymous}: no verification; the same email may register any
 * number of times</li>
 * </ul>
 */
public enum RegistrationMode {

    QUALIFIED_VERIFIED("qualified_verified", true, true),
    OPEN_VERIFIED("open_verified", false, true),
    OPEN_ANONYMOUS("open_anonymous", false, false);

    private final String value;
    private final boolean requiresQualification;
    private final boolean requiresVerification;

    RegistrationMode(String value, boolean requiresQualification, boolean requiresVerification) {
        this.value = value;
        this.requiresQualification = requiresQualification;
        this.requiresVerification = requiresVerification;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean requiresQualification() {
        return requiresQualification;
    }

    public boolean requiresVerification() {
        return requiresVerification;
    }

    /** One registration per (event, email) holds in every verified mode. */
    public boolean enforcesUniqueIdentity() {
        return requiresVerification;
    }

    @JsonCreator
    public static RegistrationMode fromValue(String value) {
        for (RegistrationMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown registration mode: " + value);
    }
}
