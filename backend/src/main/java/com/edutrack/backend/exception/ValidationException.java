package com.edutrack.backend.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends EduTrackException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
