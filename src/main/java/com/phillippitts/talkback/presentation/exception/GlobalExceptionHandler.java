package com.phillippitts.talkback.presentation.exception;

import com.phillippitts.talkback.exception.InvalidTurnInputException;
import com.phillippitts.talkback.exception.TalkBackException;
import com.phillippitts.talkback.exception.TurnNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Maps exceptions thrown by the turns API to JSON error bodies.
 *
 * <p>Collaborator failures keep their error kind on the wire; anything unexpected is reported
 * as a bare 500 and logged with its stack trace. Every body carries the request id set by
 * {@link com.phillippitts.talkback.config.logging.MdcFilter} so clients can quote it.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TurnNotFoundException.class)
    ResponseEntity<ApiError> handleTurnNotFound(TurnNotFoundException ex) {
        LOG.info("Stop requested for unknown turn {}", ex.getTurnId());
        return respond(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Turn not found", "No running turn with id " + ex.getTurnId());
    }

    @ExceptionHandler(InvalidTurnInputException.class)
    ResponseEntity<ApiError> handleInvalidInput(InvalidTurnInputException ex) {
        LOG.warn("Rejected turn input: field={}, reason={}", ex.getField(), ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid turn input", ex.getMessage());
    }

    /**
     * A collaborator failed while serving the request (HTTP 502).
     */
    @ExceptionHandler(TalkBackException.class)
    ResponseEntity<ApiError> handleCollaboratorFailure(TalkBackException ex) {
        LOG.warn("Request failed with {}: {}", ex.getErrorKind().wireName(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getErrorKind().wireName(),
                "Upstream collaborator failed", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Quote the request id when reporting this");
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String code,
                                                    String message, String details) {
        ApiError body = new ApiError(code, message, details,
                ThreadContext.get("requestId"), Instant.now());
        return ResponseEntity.status(status).body(body);
    }

    private record ApiError(
        String errorCode,
        String message,
        String details,
        String requestId,
        Instant timestamp
    ) {}
}
