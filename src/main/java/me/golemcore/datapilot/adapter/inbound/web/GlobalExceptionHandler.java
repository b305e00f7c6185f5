package me.golemcore.datapilot.adapter.inbound.web;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.datapilot.domain.exception.ArtifactNotFoundException;
import me.golemcore.datapilot.domain.exception.ConcurrentModificationException;
import me.golemcore.datapilot.domain.exception.PersistenceException;
import me.golemcore.datapilot.domain.exception.ProjectNotFoundException;
import me.golemcore.datapilot.domain.exception.ProviderException;
import me.golemcore.datapilot.domain.exception.SchemaValidationException;
import me.golemcore.datapilot.domain.exception.Violation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.concurrent.CancellationException;

/**
 * Maps domain exceptions to HTTP responses with an {@link ApiErrorResponse}
 * body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({ ProjectNotFoundException.class, ArtifactNotFoundException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(RuntimeException ex) {
        log.debug("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ConcurrentModificationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConflict(ConcurrentModificationException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(SchemaValidationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleValidation(SchemaValidationException ex) {
        log.warn("[API] Invalid arguments: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message(ex.getMessage())
                .violations(ex.getViolations().stream().map(Violation::toString).toList())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(ProviderException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleProvider(ProviderException ex) {
        log.warn("[API] Provider failure ({}): {}", ex.getProfile(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handlePersistence(PersistenceException ex) {
        log.error("[API] Persistence failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(CancellationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCancelled(CancellationException ex) {
        log.info("[API] Cancelled: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
