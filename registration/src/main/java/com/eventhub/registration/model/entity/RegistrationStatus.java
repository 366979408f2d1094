package com.eventhub.registration.model.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RegistrationStatus {

    QUALIFIED("qualified"),
    REGISTERED("registered"),
    CHECKED_IN("checked_in"),
    NOT_COMING("not_coming");

    private final String value;

    RegistrationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
