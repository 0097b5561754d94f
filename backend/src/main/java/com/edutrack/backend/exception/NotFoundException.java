package com.edutrack.backend.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends EduTrackException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
