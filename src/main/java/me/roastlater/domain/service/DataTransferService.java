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

package me.roastlater.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.roastlater.domain.exception.OperationInProgressException;
import me.roastlater.domain.exception.PreviewNotFoundException;
import me.roastlater.domain.model.CancellationToken;
import me.roastlater.domain.model.ComplianceReport;
import me.roastlater.domain.model.ErrorReport;
import me.roastlater.domain.model.ExportOptions;
import me.roastlater.domain.model.ExportResult;
import me.roastlater.domain.model.ImportOptions;
import me.roastlater.domain.model.ImportPreview;
import me.roastlater.domain.model.ImportResult;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.OperationContext;
import me.roastlater.domain.model.OperationPhase;
import me.roastlater.domain.model.OperationProgress;
import me.roastlater.domain.model.OperationType;
import me.roastlater.domain.model.ParsedSnapshot;
import me.roastlater.port.inbound.DataTransferPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Entry point used by the presentation layer.
 *
 * <p>
 * Every operation that touches the store runs on the single-threaded transfer
 * scheduler, so operations are serialized and later requests queue. Each run
 * gets its own {@link CancellationToken}; disposing a subscription cancels that
 * run, and {@link #cancelCurrentOperation()} cancels whichever run is active.
 */
@Service
@Slf4j
public class DataTransferService implements DataTransferPort {

    private final ComplianceAnalyzer complianceAnalyzer;
    private final SnapshotExportService exportService;
    private final SnapshotParser parser;
    private final ImportPreviewService previewService;
    private final ImportApplyService applyService;
    private final ErrorRecoveryClassifier classifier;
    private final Scheduler transferScheduler;
    private final Clock clock;

    private final AtomicReference<CancellationToken> activeToken = new AtomicReference<>();
    private final AtomicReference<PendingImport> pending = new AtomicReference<>();
    private final AtomicReference<PendingImport> applying = new AtomicReference<>();

    public DataTransferService(ComplianceAnalyzer complianceAnalyzer, SnapshotExportService exportService,
            SnapshotParser parser, ImportPreviewService previewService, ImportApplyService applyService,
            ErrorRecoveryClassifier classifier, @Qualifier("transferScheduler") Scheduler transferScheduler,
            Clock clock) {
        this.complianceAnalyzer = complianceAnalyzer;
        this.exportService = exportService;
        this.parser = parser;
        this.previewService = previewService;
        this.applyService = applyService;
        this.classifier = classifier;
        this.transferScheduler = transferScheduler;
        this.clock = clock;
    }

    private record PendingImport(ImportPreview preview, ParsedSnapshot parsed) {
    }

    @Override
    public ComplianceReport analyze(ExportOptions options) {
        return complianceAnalyzer.analyze(options);
    }

    @Override
    public Flux<OperationProgress<ExportResult>> startExport(ExportOptions options) {
        return tracked(token -> exportService.export(options, token));
    }

    @Override
    public Mono<ImportPreview> startImport(byte[] payload) {
        return Mono.fromCallable(() -> {
            CancellationToken token = CancellationToken.create();
            activeToken.set(token);
            try {
                ParsedSnapshot parsed = parser.parse(payload);
                token.throwIfCancelled(OperationType.VALIDATION, OperationPhase.VALIDATING);
                ImportPreview preview = previewService.buildPreview(parsed);
                PendingImport previous = pending.getAndSet(new PendingImport(preview, parsed));
                if (previous != null) {
                    log.debug("[Import] Preview {} replaced by {}", previous.preview().previewId(),
                            preview.previewId());
                }
                return preview;
            } catch (RuntimeException e) {
                classifier.report(e, OperationContext.of(OperationType.VALIDATION, OperationPhase.VALIDATING, 0, 0,
                        clock.instant()));
                throw e;
            } finally {
                activeToken.compareAndSet(token, null);
            }
        }).subscribeOn(transferScheduler);
    }

    @Override
    public Flux<OperationProgress<ImportResult>> confirmImport(String previewId, ImportOptions options) {
        return Flux.defer(() -> {
            PendingImport current = pending.get();
            if (current == null || !Objects.equals(current.preview().previewId(), previewId)
                    || !pending.compareAndSet(current, null)) {
                PreviewNotFoundException error = new PreviewNotFoundException(previewId);
                classifier.report(error, OperationContext.of(OperationType.IMPORT, OperationPhase.PREPARING, 0, 0,
                        clock.instant()));
                return Flux.error(error);
            }
            applying.set(current);
            log.info("[Import] Confirmed preview {} with strategy {}", previewId, options.strategy());
            return tracked(token -> applyService.apply(current.parsed(), current.preview(), options, token))
                    .doOnComplete(() -> applying.compareAndSet(current, null))
                    .doOnError(error -> release(current))
                    .doOnCancel(() -> release(current));
        });
    }

    /**
     * Makes a failed or cancelled preview confirmable again, unless a newer
     * preview has been started meanwhile. Runs before the terminal signal
     * reaches the caller.
     */
    private void release(PendingImport failed) {
        applying.compareAndSet(failed, null);
        if (pending.compareAndSet(null, new PendingImport(failed.preview(), failed.parsed()))) {
            log.info("[Import] Preview {} is pending again", failed.preview().previewId());
        }
    }

    @Override
    public boolean discardPreview(String previewId) {
        PendingImport running = applying.get();
        if (running != null && Objects.equals(running.preview().previewId(), previewId)) {
            throw new OperationInProgressException("Preview " + previewId + " is being applied");
        }
        PendingImport current = pending.get();
        if (current != null && Objects.equals(current.preview().previewId(), previewId)
                && pending.compareAndSet(current, null)) {
            log.info("[Import] Preview {} discarded", previewId);
            return true;
        }
        return false;
    }

    @Override
    public boolean cancelCurrentOperation() {
        CancellationToken token = activeToken.get();
        if (token == null) {
            return false;
        }
        boolean flipped = token.cancel();
        if (flipped) {
            log.info("[Transfer] Cancellation requested");
        }
        return flipped;
    }

    @Override
    public Mono<Long> estimateExportSize() {
        return Mono.fromCallable(exportService::estimateExportSize).subscribeOn(transferScheduler);
    }

    @Override
    public Mono<List<ImportWarning>> validateLocalData() {
        return Mono.fromCallable(exportService::validateLocalData).subscribeOn(transferScheduler);
    }

    @Override
    public List<ErrorReport> recentErrors(int limit) {
        return classifier.recentErrors(Math.max(0, limit));
    }

    @Override
    public int clearRecentErrors() {
        return classifier.clearRecentErrors();
    }

    private <T> Flux<OperationProgress<T>> tracked(Function<CancellationToken, Flux<OperationProgress<T>>> run) {
        return Flux.defer(() -> {
            CancellationToken token = CancellationToken.create();
            return Flux.defer(() -> {
                activeToken.set(token);
                return run.apply(token);
            })
                    .subscribeOn(transferScheduler, false)
                    .doOnCancel(token::cancel)
                    .doFinally(signal -> activeToken.compareAndSet(token, null));
        });
    }
}
