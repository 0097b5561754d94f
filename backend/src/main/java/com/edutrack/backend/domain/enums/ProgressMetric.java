package com.edutrack.backend.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressMetric {
    ASSIGNMENT("assignment"),
    QUIZ("quiz"),
    EXAM("exam"),
    ATTENDANCE("attendance"),
    BEHAVIOR("behavior"),
    CUSTOM("custom");

    private final String value;

    ProgressMetric(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
