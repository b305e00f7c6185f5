package me.golemcore.datapilot.adapter.inbound.web;

import me.golemcore.datapilot.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.datapilot.domain.exception.ArtifactNotFoundException;
import me.golemcore.datapilot.domain.exception.ConcurrentModificationException;
import me.golemcore.datapilot.domain.exception.PersistenceException;
import me.golemcore.datapilot.domain.exception.ProjectNotFoundException;
import me.golemcore.datapilot.domain.exception.ProviderException;
import me.golemcore.datapilot.domain.exception.SchemaValidationException;
import me.golemcore.datapilot.domain.exception.Violation;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapMissingProjectAndArtifactTo404() {
        expect(handler.handleNotFound(new ProjectNotFoundException("p1")), HttpStatus.NOT_FOUND,
                "Project not found: p1");
        expect(handler.handleNotFound(new ArtifactNotFoundException("p1", "model@latest")), HttpStatus.NOT_FOUND,
                null);
    }

    @Test
    void shouldMapConcurrentTurnTo409() {
        expect(handler.handleConflict(new ConcurrentModificationException("p1", "busy")), HttpStatus.CONFLICT,
                "busy");
        expect(handler.handleCancelled(new CancellationException("Turn cancelled before it started")),
                HttpStatus.CONFLICT, "Turn cancelled before it started");
    }

    @Test
    void shouldListViolationsOfValidationError() {
        SchemaValidationException ex = new SchemaValidationException("FeatureSelection", List.of(
                new Violation("max_features", Violation.Code.OUT_OF_RANGE, "must be at least 1")));

        StepVerifier.create(handler.handleValidation(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals(List.of("max_features: must be at least 1"), response.getBody().getViolations());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapProviderFailureTo502() {
        expect(handler.handleProvider(new ProviderException("openai", "Provider 'openai' is down", 5, null)),
                HttpStatus.BAD_GATEWAY, "Provider 'openai' is down");
    }

    @Test
    void shouldMapPersistenceFailureTo500() {
        expect(handler.handlePersistence(new PersistenceException("disk full", new IOException("ENOSPC"))),
                HttpStatus.INTERNAL_SERVER_ERROR, "disk full");
    }

    @Test
    void shouldKeepStatusAndReasonOfResponseStatus() {
        expect(handler.handleResponseStatus(new ResponseStatusException(HttpStatus.CONFLICT, "busy")),
                HttpStatus.CONFLICT, "busy");
    }

    @Test
    void shouldMapIllegalArgumentTo400() {
        expect(handler.handleIllegalArgument(new IllegalArgumentException("Project name must not be blank")),
                HttpStatus.BAD_REQUEST, "Project name must not be blank");
    }

    @Test
    void shouldHideDetailsOfUnexpectedError() {
        expect(handler.handleGeneric(new IllegalStateException("secret path /home/x")),
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static void expect(Mono<ResponseEntity<ApiErrorResponse>> mono, HttpStatus status, String message) {
        StepVerifier.create(mono)
                .assertNext(response -> {
                    assertEquals(status, response.getStatusCode());
                    assertEquals(status.value(), response.getBody().getStatus());
                    if (message != null) {
                        assertEquals(message, response.getBody().getMessage());
                    }
                    assertNull(response.getBody().getViolations());
                })
                .verifyComplete();
    }
}
