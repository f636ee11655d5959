package com.phillippitts.heartbeat.presentation.exception;

import com.phillippitts.heartbeat.exception.DuplicateServiceException;
import com.phillippitts.heartbeat.exception.InvalidStatusException;
import com.phillippitts.heartbeat.exception.ServiceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void notFoundIs404() {
        ResponseEntity<?> response = handler.handleServiceNotFound(new ServiceNotFoundException("svc-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString()).contains("ServiceNotFoundException").contains("svc-1");
    }

    @Test
    void duplicateIs409() {
        ResponseEntity<?> response = handler.handleDuplicate(new DuplicateServiceException("fixed-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("DuplicateServiceException");
    }

    @Test
    void invalidStatusIs400() {
        ResponseEntity<?> response = handler.handleInvalidStatus(new InvalidStatusException("bogus"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("Invalid heartbeat status").contains("bogus");
    }

    @Test
    void illegalArgumentIs400() {
        ResponseEntity<?> response = handler.handleIllegalArgument(
                new IllegalArgumentException("Service name must not be blank"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void unexpectedIs500AndHidesDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("database password: secret123"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        String body = response.getBody().toString();
        assertThat(body).contains("InternalServerError").doesNotContain("secret123");
    }

    @Test
    void errorResponseHasApiErrorStructure() {
        String body = handler.handleInvalidStatus(new InvalidStatusException("x")).getBody().toString();
        assertThat(body).contains("errorCode=").contains("message=").contains("details=").contains("timestamp=");
    }
}
