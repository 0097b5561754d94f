package com.edutrack.backend.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InvoiceStatus {
    DRAFT("draft"),
    OPEN("open"),
    PAID("paid"),
    VOID("void");

    private final String value;

    InvoiceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
