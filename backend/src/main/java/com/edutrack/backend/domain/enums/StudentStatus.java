package com.edutrack.backend.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StudentStatus {
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String value;

    StudentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
