package com.eventhub.registration.model.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventStatus {

    DRAFT("draft"),
    PUBLISHED("published"),
    ARCHIVED("archived");

    private final String value;

    EventStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
