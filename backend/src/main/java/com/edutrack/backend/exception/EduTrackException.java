package com.edutrack.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of the errors this service raises on purpose. Each one knows the HTTP status it maps to.
 */
public abstract class EduTrackException extends RuntimeException {

    private final HttpStatus status;

    protected EduTrackException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected EduTrackException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
