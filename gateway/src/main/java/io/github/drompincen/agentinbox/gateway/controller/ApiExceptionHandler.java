package io.github.drompincen.agentinbox.gateway.controller;

import io.github.drompincen.agentinbox.runtime.approval.ApprovalNotFoundException;
import io.github.drompincen.agentinbox.runtime.approval.ApprovalNotPendingException;
import io.github.drompincen.agentinbox.runtime.inbox.ThreadBusyException;
import io.github.drompincen.agentinbox.runtime.inbox.ThreadNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps inbox exceptions to {@code {status, message}} bodies for the REST controllers.
 */
@RestControllerAdvice(basePackages = "io.github.drompincen.agentinbox.gateway.controller")
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ApiError(int status, String message) {}

    @ExceptionHandler({ThreadNotFoundException.class, ApprovalNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(RuntimeException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler({ThreadBusyException.class, ApprovalNotPendingException.class})
    public ResponseEntity<ApiError> handleConflict(RuntimeException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ApiError(status.value(), message));
    }
}
