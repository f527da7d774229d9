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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.roastlater.domain.exception.CorruptedDataException;
import me.roastlater.domain.exception.PartialImportExceededException;
import me.roastlater.domain.exception.StoreAccessException;
import me.roastlater.domain.model.CancellationToken;
import me.roastlater.domain.model.ContentRecord;
import me.roastlater.domain.model.ErrorReport;
import me.roastlater.domain.model.ImportOptions;
import me.roastlater.domain.model.ImportPreview;
import me.roastlater.domain.model.ImportResult;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.ImportWarningType;
import me.roastlater.domain.model.OperationContext;
import me.roastlater.domain.model.OperationPhase;
import me.roastlater.domain.model.OperationProgress;
import me.roastlater.domain.model.OperationType;
import me.roastlater.domain.model.ParsedSnapshot;
import me.roastlater.domain.model.Snapshot;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.port.outbound.LocalStorePort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Applies a parsed snapshot to the local store.
 *
 * <p>
 * <b>Replace</b> validates every record first and leaves the store untouched
 * if any is invalid. It then swaps records and favorites for the incoming ones
 * and overlays preferences key by key; a store failure during the swap restores
 * the previous state. Cancellation is honoured only before the swap starts.
 *
 * <p>
 * <b>Merge</b> applies records in order and commits valid ones in batches.
 * Invalid records count against the error budget; when the budget is exceeded
 * the pending batch is flushed and the import aborts with the committed ids
 * listed. Committed records are never rolled back.
 *
 * <p>
 * The returned stream is not scheduled; subscribers choose the thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportApplyService {

    private final LocalStorePort localStore;
    private final RecordInspector inspector;
    private final ErrorRecoveryClassifier classifier;
    private final RoastLaterProperties properties;
    private final Clock clock;

    public Flux<OperationProgress<ImportResult>> apply(ParsedSnapshot parsed, ImportPreview preview,
            ImportOptions options, CancellationToken token) {
        return Flux.create(sink -> new ApplyRun(parsed.snapshot(), preview, options, token, sink).run());
    }

    private final class ApplyRun {

        private final Snapshot snapshot;
        private final ImportPreview preview;
        private final ImportOptions options;
        private final CancellationToken token;
        private final FluxSink<OperationProgress<ImportResult>> sink;
        private final int batchSize;

        private OperationPhase phase = OperationPhase.PREPARING;
        private double progress;
        private int processed;
        private int total;

        ApplyRun(Snapshot snapshot, ImportPreview preview, ImportOptions options, CancellationToken token,
                FluxSink<OperationProgress<ImportResult>> sink) {
            this.snapshot = snapshot;
            this.preview = preview;
            this.options = options;
            this.token = token;
            this.sink = sink;
            this.batchSize = Math.max(1, properties.getTransfer().getProgressBatchSize());
        }

        void run() {
            try {
                enter(OperationPhase.PREPARING, 0.0);
                log.info("[Import] Applying snapshot with strategy {} ({} records)", options.strategy(),
                        snapshot.getContentRecords().size());
                ImportResult result = options.isReplace() ? replace() : merge();
                sink.next(OperationProgress.completed(OperationType.IMPORT, result, total));
                sink.complete();
            } catch (RuntimeException e) {
                OperationContext context = new OperationContext(OperationType.IMPORT, phase, processed, total,
                        clock.instant(), options.allowPartialImport());
                ErrorReport report = classifier.report(e, context);
                sink.next(OperationProgress.failed(OperationType.IMPORT, progress, processed, total, report));
                sink.error(e);
            }
        }

        // ==================== Replace ====================

        private ImportResult replace() {
            List<ContentRecord> incoming = snapshot.getContentRecords();
            total = incoming.size();
            enter(OperationPhase.VALIDATING, 0.05);
            for (int i = 0; i < incoming.size(); i++) {
                token.throwIfCancelled(OperationType.IMPORT, phase);
                ContentRecord contentRecord = incoming.get(i);
                if (!contentRecord.hasContent()) {
                    throw new CorruptedDataException("contentRecords[" + i + "].content", "empty");
                }
                if (!contentRecord.hasIntensityInRange()) {
                    throw new CorruptedDataException("contentRecords[" + i + "].intensity",
                            "out of range: " + contentRecord.getIntensity());
                }
                processed++;
            }
            tick(0.20);
            token.throwIfCancelled(OperationType.IMPORT, phase);

            List<ContentRecord> backupRecords = localStore.readAllRecords();
            Set<String> backupFavorites = localStore.readFavoriteIds();
            Map<String, Object> backupPreferences = localStore.readPreferences();
            log.debug("[Import] Backed up {} records before replace", backupRecords.size());

            Set<String> favorites = new LinkedHashSet<>(snapshot.getFavoriteIds());
            int preferencesUpdated;
            try {
                processed = 0;
                phase = OperationPhase.PROCESSING_RECORDS;
                tick(0.25);
                List<ContentRecord> replacement = new ArrayList<>(incoming.size());
                for (ContentRecord contentRecord : incoming) {
                    replacement.add(contentRecord.toBuilder().favorite(favorites.contains(contentRecord.getId()))
                            .build());
                    processed++;
                    if (processed % batchSize == 0 || processed == total) {
                        tick(0.25 + 0.40 * processed / total);
                    }
                }
                localStore.clearRecordsAndFavorites();
                localStore.writeAllRecords(replacement);

                phase = OperationPhase.PROCESSING_FAVORITES;
                tick(0.70);
                localStore.writeFavoriteIds(favorites);

                phase = OperationPhase.PROCESSING_PREFERENCES;
                tick(0.80);
                preferencesUpdated = overlayPreferences(backupPreferences);

                phase = OperationPhase.SAVING;
                tick(0.95);
            } catch (RuntimeException e) {
                restore(backupRecords, backupFavorites, backupPreferences, e);
                throw new StoreAccessException("Replace import failed, previous state restored", e);
            }

            processed = total;
            log.info("[Import] Replace completed: {} records, {} favorites, {} preferences updated",
                    incoming.size(), favorites.size(), preferencesUpdated);
            return new ImportResult(options.strategy(), incoming.size(), 0, 0, favorites.size(),
                    preferencesUpdated, preview.warnings(), clock.instant());
        }

        private void restore(List<ContentRecord> records, Set<String> favorites, Map<String, Object> preferences,
                RuntimeException failure) {
            log.warn("[Import] Replace failed during {}, restoring previous state", phase);
            try {
                localStore.writeAllRecords(records);
                localStore.writeFavoriteIds(favorites);
                localStore.writePreferences(preferences);
            } catch (RuntimeException restoreError) {
                failure.addSuppressed(restoreError);
                log.error("[Import] Failed to restore previous state after replace failure", restoreError);
            }
        }

        // ==================== Merge ====================

        private ImportResult merge() {
            List<ContentRecord> incoming = snapshot.getContentRecords();
            total = incoming.size();
            enter(OperationPhase.VALIDATING, 0.05);
            Set<String> localIds = new HashSet<>();
            for (ContentRecord localRecord : localStore.readAllRecords()) {
                localIds.add(localRecord.getId());
            }

            List<ImportWarning> warnings = new ArrayList<>(preview.warnings());
            List<ContentRecord> pending = new ArrayList<>(batchSize);
            List<String> committedIds = new ArrayList<>();
            int skipped = 0;
            int failures = 0;

            enter(OperationPhase.PROCESSING_RECORDS, 0.10);
            for (ContentRecord contentRecord : incoming) {
                if (token.isCancelled()) {
                    flush(pending, committedIds);
                    token.throwIfCancelled(OperationType.IMPORT, phase);
                }
                processed++;
                if (options.skipDuplicates() && localIds.contains(contentRecord.getId())) {
                    skipped++;
                } else if (!inspector.isApplicable(contentRecord)) {
                    failures++;
                    warnings.add(ImportWarning.forItem(ImportWarningType.RECORD_REJECTED, contentRecord.getId(),
                            rejectionReason(contentRecord)));
                    if (!options.allowPartialImport() || failures > options.maxErrorsAllowed()) {
                        flush(pending, committedIds);
                        throw new PartialImportExceededException(failures, committedIds,
                                notCommitted(incoming, committedIds));
                    }
                } else {
                    pending.add(contentRecord);
                    if (pending.size() >= batchSize) {
                        flush(pending, committedIds);
                    }
                }
                if (processed % batchSize == 0 || processed == total) {
                    tick(0.10 + 0.60 * processed / total);
                }
            }
            flush(pending, committedIds);

            processed = 0;
            total = snapshot.getFavoriteIds().size();
            enter(OperationPhase.PROCESSING_FAVORITES, 0.75);
            int favoritesApplied = mergeFavorites(localIds, committedIds);

            enter(OperationPhase.PROCESSING_PREFERENCES, 0.85);
            int preferencesUpdated = overlayPreferences(localStore.readPreferences());

            enter(OperationPhase.SAVING, 0.95);
            total = incoming.size();
            processed = total;
            log.info("[Merge] Merge completed: {} imported, {} skipped, {} failed, {} favorites, "
                    + "{} preferences updated", committedIds.size(), skipped, failures, favoritesApplied,
                    preferencesUpdated);
            return new ImportResult(options.strategy(), committedIds.size(), skipped, failures, favoritesApplied,
                    preferencesUpdated, warnings, clock.instant());
        }

        private void flush(List<ContentRecord> pending, List<String> committedIds) {
            if (pending.isEmpty()) {
                return;
            }
            localStore.upsertRecords(pending);
            for (ContentRecord contentRecord : pending) {
                committedIds.add(contentRecord.getId());
            }
            log.debug("[Merge] Committed batch of {} records ({} total)", pending.size(), committedIds.size());
            pending.clear();
        }

        /**
         * Union of local and incoming favorites. Without
         * {@code preserveExistingFavorites}, overwritten records take the incoming
         * favorite state.
         */
        private int mergeFavorites(Set<String> localIds, List<String> committedIds) {
            Set<String> before = localStore.readFavoriteIds();
            Set<String> incomingFavorites = snapshot.getFavoriteIds();
            Set<String> known = new HashSet<>(localIds);
            known.addAll(committedIds);

            Set<String> merged = new LinkedHashSet<>(before);
            if (!options.preserveExistingFavorites()) {
                for (String committedId : committedIds) {
                    if (localIds.contains(committedId) && !incomingFavorites.contains(committedId)) {
                        merged.remove(committedId);
                    }
                }
            }
            for (String favoriteId : incomingFavorites) {
                token.throwIfCancelled(OperationType.IMPORT, phase);
                if (known.contains(favoriteId)) {
                    merged.add(favoriteId);
                }
                processed++;
            }
            if (!merged.equals(before)) {
                localStore.writeFavoriteIds(merged);
            }
            tick(0.80);

            int applied = 0;
            for (String favoriteId : merged) {
                if (!before.contains(favoriteId)) {
                    applied++;
                }
            }
            return applied;
        }

        // ==================== Shared ====================

        /**
         * Writes local preferences overlaid by incoming values and returns the
         * number of keys whose value changed.
         */
        private int overlayPreferences(Map<String, Object> local) {
            Map<String, Object> merged = new LinkedHashMap<>(local);
            int updated = 0;
            for (Map.Entry<String, Object> entry : snapshot.getPreferences().entrySet()) {
                if (!Objects.equals(merged.get(entry.getKey()), entry.getValue())
                        || !merged.containsKey(entry.getKey())) {
                    updated++;
                }
                merged.put(entry.getKey(), entry.getValue());
            }
            if (updated > 0) {
                localStore.writePreferences(merged);
            }
            return updated;
        }

        private List<String> notCommitted(List<ContentRecord> incoming, List<String> committedIds) {
            Set<String> committed = new HashSet<>(committedIds);
            List<String> result = new ArrayList<>();
            for (ContentRecord contentRecord : incoming) {
                if (!committed.contains(contentRecord.getId())) {
                    result.add(contentRecord.getId());
                }
            }
            return result;
        }

        private String rejectionReason(ContentRecord contentRecord) {
            if (!contentRecord.hasContent()) {
                return "empty content";
            }
            return "intensity " + contentRecord.getIntensity();
        }

        private void enter(OperationPhase next, double fraction) {
            token.throwIfCancelled(OperationType.IMPORT, next);
            phase = next;
            tick(fraction);
        }

        private void tick(double fraction) {
            progress = Math.max(progress, fraction);
            sink.next(OperationProgress.of(OperationType.IMPORT, phase, progress, processed, total));
        }
    }
}
