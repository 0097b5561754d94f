package com.edutrack.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Fallback for any failure coming out of the document store that was not raised on purpose.
 * The original exception type is not exposed to clients; only a truncated message is kept.
 */
public class StoreUnavailableException extends EduTrackException {

    static final int MAX_DETAIL_LENGTH = 200;

    public StoreUnavailableException(Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "Database unavailable: " + truncate(cause.getMessage()), cause);
    }

    static String truncate(String message) {
        if (message == null) {
            return "unknown error";
        }
        return message.length() <= MAX_DETAIL_LENGTH ? message : message.substring(0, MAX_DETAIL_LENGTH);
    }
}
