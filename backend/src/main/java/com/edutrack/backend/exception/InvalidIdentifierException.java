package com.edutrack.backend.exception;

public class InvalidIdentifierException extends ValidationException {

    public InvalidIdentifierException(String value) {
        super("Invalid id: " + value);
    }
}
