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

package me.roastlater.adapter.inbound.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.roastlater.adapter.inbound.web.dto.ApiErrorResponse;
import me.roastlater.domain.exception.DataTransferException;
import me.roastlater.domain.model.ErrorReport;
import me.roastlater.domain.service.ErrorRecoveryClassifier;
import me.roastlater.infrastructure.i18n.MessageService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for data transfer controllers.
 */
@ControllerAdvice(basePackages = "me.roastlater.adapter.inbound.web.controller")
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final ErrorRecoveryClassifier classifier;
    private final TransferViewRenderer renderer;
    private final MessageService messageService;

    @ExceptionHandler(DataTransferException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleTransfer(DataTransferException ex) {
        HttpStatus status = statusFor(ex);
        log.warn("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        ErrorReport report = new ErrorReport(classifier.classify(ex), null, classifier.recoveryOptions(ex, null));
        ApiErrorResponse body = renderer.error(report, status.value(), messageService.getLanguage());
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    static HttpStatus statusFor(DataTransferException ex) {
        return switch (ex.getKind()) {
        case CORRUPTED_DATA, VERSION_MISMATCH -> HttpStatus.UNPROCESSABLE_ENTITY;
        case PREVIEW_NOT_FOUND -> HttpStatus.NOT_FOUND;
        case OPERATION_IN_PROGRESS, PARTIAL_IMPORT_EXCEEDED, OPERATION_CANCELLED -> HttpStatus.CONFLICT;
        case INSUFFICIENT_STORAGE -> HttpStatus.INSUFFICIENT_STORAGE;
        case STORE_ACCESS, SERIALIZATION_FAILED, UNKNOWN -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
