package io.github.drompincen.agentinbox.gateway.controller;

import io.github.drompincen.agentinbox.runtime.approval.ApprovalNotPendingException;
import io.github.drompincen.agentinbox.runtime.inbox.ThreadBusyException;
import io.github.drompincen.agentinbox.runtime.inbox.ThreadNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void mapsDomainExceptionsToStatusCodes() {
        ResponseEntity<ApiExceptionHandler.ApiError> notFound = handler.handleNotFound(new ThreadNotFoundException("t9"));
        assertThat(notFound.getStatusCode().value()).isEqualTo(404);
        assertThat(notFound.getBody().message()).isEqualTo("Thread not found: t9");

        assertThat(handler.handleConflict(new ThreadBusyException("busy")).getBody().status()).isEqualTo(409);
        assertThat(handler.handleConflict(new ApprovalNotPendingException("ap-1")).getStatusCode().value()).isEqualTo(409);
        assertThat(handler.handleBadRequest(new IllegalArgumentException("bad")).getStatusCode().value()).isEqualTo(400);
    }

    @Test
    void internalErrorsHideDetails() {
        ResponseEntity<ApiExceptionHandler.ApiError> response = handler.handleGeneric(new IllegalStateException("secret"));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().message()).isEqualTo("Internal server error");
    }
}
