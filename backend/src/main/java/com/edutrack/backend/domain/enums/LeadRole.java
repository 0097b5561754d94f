package com.edutrack.backend.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LeadRole {
    SCHOOL_ADMIN("school admin"),
    TEACHER("teacher"),
    PARENT("parent"),
    STUDENT("student"),
    OTHER("other");

    private final String value;

    LeadRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
