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

package me.roastlater.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.roastlater.adapter.inbound.web.TransferViewRenderer;
import me.roastlater.adapter.inbound.web.dto.ComplianceReportResponse;
import me.roastlater.adapter.inbound.web.dto.ErrorReportDto;
import me.roastlater.adapter.inbound.web.dto.ImportConfirmRequest;
import me.roastlater.adapter.inbound.web.dto.ImportPreviewResponse;
import me.roastlater.adapter.inbound.web.dto.ImportWarningDto;
import me.roastlater.adapter.inbound.web.dto.ProgressEventDto;
import me.roastlater.domain.exception.PreviewNotFoundException;
import me.roastlater.domain.model.ComplianceReport;
import me.roastlater.domain.model.ErrorReport;
import me.roastlater.domain.model.ExportOptions;
import me.roastlater.domain.model.ImportOptions;
import me.roastlater.domain.model.ImportStrategy;
import me.roastlater.domain.model.OperationProgress;
import me.roastlater.domain.model.OperationType;
import me.roastlater.domain.service.ErrorRecoveryClassifier;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.infrastructure.i18n.MessageService;
import me.roastlater.port.inbound.DataTransferPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dashboard endpoints for exporting and importing local data.
 */
@RestController
@RequestMapping("/api/data")
@RequiredArgsConstructor
@Slf4j
public class DataTransferController {

    private final DataTransferPort dataTransferPort;
    private final TransferViewRenderer renderer;
    private final ErrorRecoveryClassifier classifier;
    private final MessageService messageService;
    private final RoastLaterProperties properties;

    @PostMapping("/compliance")
    public Mono<ResponseEntity<ComplianceReportResponse>> analyze(
            @RequestBody ExportOptions options,
            @RequestParam(required = false) String lang) {
        ComplianceReport report = dataTransferPort.analyze(options);
        return Mono.just(ResponseEntity.ok(renderer.compliance(report, messageService.resolveLanguage(lang))));
    }

    @PostMapping(value = "/export", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressEventDto>> export(
            @RequestBody ExportOptions options,
            @RequestParam(defaultValue = "false") boolean acknowledged,
            @RequestParam(required = false) String lang) {
        String language = messageService.resolveLanguage(lang);
        if (dataTransferPort.analyze(options).requiresAcknowledgement() && !acknowledged) {
            log.info("[API] Export refused: compliance acknowledgement required");
            return Flux.error(new ResponseStatusException(HttpStatus.PRECONDITION_REQUIRED,
                    messageService.getMessage("transfer.compliance.acknowledgement_required", language)));
        }
        return stream(OperationType.EXPORT, dataTransferPort.startExport(options), language);
    }

    @PostMapping("/import/preview")
    public Mono<ResponseEntity<ImportPreviewResponse>> preview(
            @RequestBody byte[] payload,
            @RequestParam(required = false) String lang) {
        String language = messageService.resolveLanguage(lang);
        return dataTransferPort.startImport(payload)
                .map(preview -> ResponseEntity.ok(renderer.preview(preview, language)));
    }

    @PostMapping(value = "/import/{previewId}/confirm", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressEventDto>> confirm(
            @PathVariable String previewId,
            @RequestBody(required = false) ImportConfirmRequest request,
            @RequestParam(required = false) String lang) {
        String language = messageService.resolveLanguage(lang);
        ImportOptions options = toOptions(request);
        return stream(OperationType.IMPORT, dataTransferPort.confirmImport(previewId, options), language);
    }

    @DeleteMapping("/import/{previewId}")
    public Mono<ResponseEntity<Void>> discard(@PathVariable String previewId) {
        if (!dataTransferPort.discardPreview(previewId)) {
            return Mono.error(new PreviewNotFoundException(previewId));
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/cancel")
    public Mono<ResponseEntity<Map<String, Boolean>>> cancel() {
        boolean cancelled = dataTransferPort.cancelCurrentOperation();
        return Mono.just(ResponseEntity.ok(Map.of("cancelled", cancelled)));
    }

    @GetMapping("/export/estimate")
    public Mono<ResponseEntity<Map<String, Long>>> estimate() {
        return dataTransferPort.estimateExportSize()
                .map(size -> ResponseEntity.ok(Map.of("estimatedBytes", size)));
    }

    @GetMapping("/export/validation")
    public Mono<ResponseEntity<List<ImportWarningDto>>> validate(@RequestParam(required = false) String lang) {
        String language = messageService.resolveLanguage(lang);
        return dataTransferPort.validateLocalData()
                .map(warnings -> ResponseEntity.ok(renderer.warnings(warnings, language)));
    }

    @GetMapping("/errors")
    public Mono<ResponseEntity<List<ErrorReportDto>>> errors(
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String lang) {
        String language = messageService.resolveLanguage(lang);
        List<ErrorReportDto> reports = dataTransferPort.recentErrors(limit).stream()
                .map(report -> renderer.errorReport(report, language))
                .toList();
        return Mono.just(ResponseEntity.ok(reports));
    }

    @DeleteMapping("/errors")
    public Mono<ResponseEntity<Map<String, Integer>>> clearErrors() {
        return Mono.just(ResponseEntity.ok(Map.of("removed", dataTransferPort.clearRecentErrors())));
    }

    private <T> Flux<ServerSentEvent<ProgressEventDto>> stream(OperationType operation,
            Flux<OperationProgress<T>> progress, String language) {
        AtomicBoolean terminalSent = new AtomicBoolean(false);
        return progress
                .map(update -> {
                    if (update.isTerminal()) {
                        terminalSent.set(true);
                    }
                    return ServerSentEvent.<ProgressEventDto>builder()
                            .event(update.phase().name().toLowerCase(Locale.ROOT))
                            .data(renderer.progress(update, language))
                            .build();
                })
                .onErrorResume(error -> {
                    if (terminalSent.get()) {
                        return Flux.empty();
                    }
                    log.warn("[API] {} stream failed before start: {}", operation, error.getMessage());
                    ErrorReport report = new ErrorReport(classifier.classify(error), null,
                            classifier.recoveryOptions(error, null));
                    ProgressEventDto failed = ProgressEventDto.builder()
                            .operation(operation.name())
                            .phase("FAILED")
                            .error(renderer.error(report, 0, language))
                            .build();
                    failed.setMessage(failed.getError().getMessage());
                    return Flux.just(ServerSentEvent.<ProgressEventDto>builder()
                            .event("failed")
                            .data(failed)
                            .build());
                });
    }

    private ImportOptions toOptions(ImportConfirmRequest request) {
        int defaultMaxErrors = properties.getTransfer().getDefaultMaxErrorsAllowed();
        if (request == null) {
            return ImportOptions.merge(defaultMaxErrors);
        }
        ImportStrategy strategy = request.getStrategy() != null
                ? ImportStrategy.valueOf(request.getStrategy().toUpperCase(Locale.ROOT))
                : ImportStrategy.MERGE;
        ImportOptions preset = strategy == ImportStrategy.REPLACE
                ? ImportOptions.replace()
                : ImportOptions.merge(defaultMaxErrors);
        return new ImportOptions(
                strategy,
                request.getSkipDuplicates() != null ? request.getSkipDuplicates() : preset.skipDuplicates(),
                request.getPreserveExistingFavorites() != null ? request.getPreserveExistingFavorites()
                        : preset.preserveExistingFavorites(),
                request.getAllowPartialImport() != null ? request.getAllowPartialImport()
                        : preset.allowPartialImport(),
                request.getMaxErrorsAllowed() != null ? request.getMaxErrorsAllowed() : preset.maxErrorsAllowed());
    }
}
