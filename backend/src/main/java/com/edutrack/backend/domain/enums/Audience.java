package com.edutrack.backend.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Audience {
    ALL("all"),
    STUDENTS("students"),
    PARENTS("parents"),
    TEACHERS("teachers");

    private final String value;

    Audience(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
