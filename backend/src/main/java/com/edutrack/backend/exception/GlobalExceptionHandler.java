package com.edutrack.backend.exception;

import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Errors raised on purpose ({@link EduTrackException}) keep their own status. Payload and
 * query binding failures are schema violations and answer 422. Anything else is a bug and
 * answers 500.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EduTrackException.class)
    public ProblemDetail handleEduTrack(EduTrackException ex) {
        if (ex instanceof StoreUnavailableException) {
            log.error("Store failure: {}", ex.getMessage(), ex.getCause());
        } else {
            log.warn("Request rejected ({}): {}", ex.getStatus().value(), ex.getMessage());
        }
        return problem(ex.getStatus(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.warn("Validation failed: {}", detail);
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable payload: {}", ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad parameter {}: {}", ex.getName(), ex.getValue());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid value for parameter '" + ex.getName() + "'");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse) {
            // framework errors (unknown route, wrong method, ...) already carry their status
            ProblemDetail body = ((ErrorResponse) ex).getBody();
            log.warn("Request rejected ({}): {}", body.getStatus(), ex.getMessage());
            return body;
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
