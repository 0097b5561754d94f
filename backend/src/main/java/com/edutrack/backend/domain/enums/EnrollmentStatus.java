package com.edutrack.backend.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EnrollmentStatus {
    ENROLLED("enrolled"),
    COMPLETED("completed"),
    DROPPED("dropped");

    private final String value;

    EnrollmentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
