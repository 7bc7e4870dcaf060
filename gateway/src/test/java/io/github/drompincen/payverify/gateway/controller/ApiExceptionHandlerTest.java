package io.github.drompincen.payverify.gateway.controller;

import io.github.drompincen.payverify.runtime.verification.NotFoundException;
import io.github.drompincen.payverify.runtime.verification.PersistenceException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void unknownIdIs404() {
        ResponseEntity<Map<String, Object>> response =
                handler.notFound(new NotFoundException("Application not found: a1"));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody())
                .containsEntry("error", "not_found")
                .containsEntry("message", "Application not found: a1")
                .containsKey("timestamp");
    }

    @Test
    void invalidArgumentIs400NotNotFound() {
        ResponseEntity<Map<String, Object>> response =
                handler.badRequest(new IllegalArgumentException("scorePercent out of range: 120.0"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody()).containsEntry("error", "bad_request");
    }

    @Test
    void storageFailureIs503() {
        assertThat(handler.storageUnavailable(new PersistenceException("mongo down", null)).getStatusCode().value())
                .isEqualTo(503);
    }

    @Test
    void unexpectedErrorWithoutMessage() {
        ResponseEntity<Map<String, Object>> response = handler.internal(new NullPointerException());

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody()).containsEntry("message", "unexpected error");
    }
}
