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
import me.roastlater.domain.exception.InsufficientStorageException;
import me.roastlater.domain.exception.StoreAccessException;
import me.roastlater.domain.model.CancellationToken;
import me.roastlater.domain.model.ContentRecord;
import me.roastlater.domain.model.DeviceInfo;
import me.roastlater.domain.model.ErrorReport;
import me.roastlater.domain.model.ExportOptions;
import me.roastlater.domain.model.ExportResult;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.ImportWarningType;
import me.roastlater.domain.model.OperationContext;
import me.roastlater.domain.model.OperationPhase;
import me.roastlater.domain.model.OperationProgress;
import me.roastlater.domain.model.OperationType;
import me.roastlater.domain.model.PreferenceKeys;
import me.roastlater.domain.model.Snapshot;
import me.roastlater.domain.model.UsageStatistics;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.port.outbound.LocalStorePort;
import me.roastlater.port.outbound.StoragePort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces snapshot files from the local store.
 *
 * <p>
 * An export runs through PREPARING, COLLECTING_DATA, PROCESSING_RECORDS,
 * PROCESSING_FAVORITES, PROCESSING_PREFERENCES, GENERATING_METADATA,
 * SERIALIZING and WRITING before COMPLETED. Data is collected once at the
 * start; the file is written atomically and a failed or cancelled export
 * leaves no file behind.
 *
 * <p>
 * The returned stream is not scheduled; subscribers choose the thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotExportService {

    static final long ESTIMATED_BYTES_PER_RECORD = 500;
    static final long ESTIMATED_METADATA_BYTES = 3 * 1024L;

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyyMMdd-HHmmss-SSS")
            .withZone(ZoneOffset.UTC);

    private final LocalStorePort localStore;
    private final StoragePort storagePort;
    private final SnapshotCodec codec;
    private final ContentAnonymizer anonymizer;
    private final RecordInspector inspector;
    private final ErrorRecoveryClassifier classifier;
    private final RoastLaterProperties properties;
    private final Clock clock;

    public Flux<OperationProgress<ExportResult>> export(ExportOptions options, CancellationToken token) {
        return Flux.create(sink -> new ExportRun(options, token, sink).run());
    }

    /**
     * Rough size of the next export: 500 bytes per record plus 3 KiB of
     * metadata.
     */
    public long estimateExportSize() {
        return localStore.readAllRecords().size() * ESTIMATED_BYTES_PER_RECORD + ESTIMATED_METADATA_BYTES;
    }

    /**
     * Integrity check of the local state before export.
     */
    public List<ImportWarning> validateLocalData() {
        List<ContentRecord> records = localStore.readAllRecords();
        Set<String> favorites = localStore.readFavoriteIds();
        Instant now = clock.instant();

        List<ImportWarning> warnings = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ContentRecord contentRecord : records) {
            if (!seen.add(contentRecord.getId())) {
                warnings.add(ImportWarning.forItem(ImportWarningType.DUPLICATE_RECORD, contentRecord.getId(), null));
            }
            warnings.addAll(inspector.inspect(contentRecord, now));
        }
        for (String favoriteId : favorites) {
            if (!seen.contains(favoriteId)) {
                warnings.add(ImportWarning.forItem(ImportWarningType.ORPHAN_FAVORITE, favoriteId, null));
            }
        }
        log.info("[Export] Local data validation: {} records, {} warnings", records.size(), warnings.size());
        return warnings;
    }

    private final class ExportRun {

        private final ExportOptions options;
        private final CancellationToken token;
        private final FluxSink<OperationProgress<ExportResult>> sink;

        private OperationPhase phase = OperationPhase.PREPARING;
        private double progress;
        private int processed;
        private int total;

        ExportRun(ExportOptions options, CancellationToken token, FluxSink<OperationProgress<ExportResult>> sink) {
            this.options = options;
            this.token = token;
            this.sink = sink;
        }

        void run() {
            try {
                ExportResult result = execute();
                sink.next(OperationProgress.completed(OperationType.EXPORT, result, total));
                sink.complete();
            } catch (RuntimeException e) {
                OperationContext context = OperationContext.of(OperationType.EXPORT, phase, processed, total,
                        clock.instant());
                ErrorReport report = classifier.report(e, context);
                sink.next(OperationProgress.failed(OperationType.EXPORT, progress, processed, total, report));
                sink.error(e);
            }
        }

        private ExportResult execute() {
            int batchSize = Math.max(1, properties.getTransfer().getProgressBatchSize());
            enter(OperationPhase.PREPARING, 0.0);
            log.info("[Export] Starting export (credentials={}, deviceInfo={}, statistics={}, anonymize={})",
                    options.includeCredentials(), options.includeDeviceInfo(), options.includeUsageStatistics(),
                    options.anonymize());

            enter(OperationPhase.COLLECTING_DATA, 0.05);
            List<ContentRecord> localRecords = localStore.readAllRecords();
            Set<String> localFavorites = localStore.readFavoriteIds();
            Map<String, Object> localPreferences = localStore.readPreferences();

            // Records
            total = localRecords.size();
            enter(OperationPhase.PROCESSING_RECORDS, 0.10);
            List<ContentRecord> records = new ArrayList<>(localRecords.size());
            Set<String> exportedIds = new HashSet<>();
            for (ContentRecord localRecord : localRecords) {
                token.throwIfCancelled(OperationType.EXPORT, phase);
                records.add(exportRecord(localRecord, localFavorites));
                exportedIds.add(localRecord.getId());
                processed++;
                if (processed % batchSize == 0 || processed == total) {
                    tick(0.10 + 0.50 * processed / total);
                }
            }

            // Favorites
            processed = 0;
            total = localFavorites.size();
            enter(OperationPhase.PROCESSING_FAVORITES, 0.60);
            Set<String> favorites = new LinkedHashSet<>();
            for (String favoriteId : localFavorites) {
                token.throwIfCancelled(OperationType.EXPORT, phase);
                if (exportedIds.contains(favoriteId)) {
                    favorites.add(favoriteId);
                }
                processed++;
                if (processed % batchSize == 0 || processed == total) {
                    tick(0.60 + 0.10 * processed / total);
                }
            }

            processed = 0;
            total = 0;
            enter(OperationPhase.PROCESSING_PREFERENCES, 0.75);
            Map<String, Object> preferences = exportPreferences(localPreferences);

            enter(OperationPhase.GENERATING_METADATA, 0.80);
            Instant exportTimestamp = clock.instant();
            Snapshot snapshot = Snapshot.builder()
                    .schemaVersion(SnapshotCodec.CURRENT_SCHEMA_VERSION)
                    .appVersion(properties.getAppVersion())
                    .exportTimestamp(exportTimestamp)
                    .deviceInfo(options.includeDeviceInfo() ? currentDevice() : null)
                    .usageStatistics(options.includeUsageStatistics() ? statistics(records, favorites) : null)
                    .preferences(preferences)
                    .favoriteIds(favorites)
                    .contentRecords(records)
                    .build();

            enter(OperationPhase.SERIALIZING, 0.85);
            SnapshotCodec.EncodedSnapshot encoded = codec.encode(snapshot);
            byte[] payload = encoded.payload();

            enter(OperationPhase.WRITING, 0.90);
            String directory = properties.getTransfer().getExportDirectory();
            long available = checkStorage(directory, payload.length);
            token.throwIfCancelled(OperationType.EXPORT, phase);

            String fileName = "roastlater-export-" + FILE_TIMESTAMP.format(exportTimestamp) + ".json";
            try {
                storagePort.putObjectAtomic(directory, fileName, payload, false).join();
            } catch (RuntimeException e) {
                throw new InsufficientStorageException(payload.length, available, e);
            }
            restrictToOwner(directory, fileName);

            total = records.size();
            processed = total;
            log.info("[Export] Export completed: {} records, {} favorites, {} bytes -> {}/{}",
                    records.size(), favorites.size(), payload.length, directory, fileName);
            return new ExportResult(snapshot, fileName, payload.length, encoded.checksum());
        }

        /**
         * The export may hold credentials. A file that cannot be restricted is
         * removed again.
         */
        private void restrictToOwner(String directory, String fileName) {
            try {
                if (!storagePort.restrictToOwner(directory, fileName).join()) {
                    log.debug("[Export] No POSIX permissions on this filesystem, {} keeps default access", fileName);
                }
            } catch (RuntimeException e) {
                try {
                    storagePort.deleteObject(directory, fileName).join();
                } catch (RuntimeException cleanup) {
                    e.addSuppressed(cleanup);
                    log.warn("[Export] Failed to remove unprotected export {}/{}", directory, fileName);
                }
                throw new StoreAccessException("Failed to restrict export file " + fileName, e);
            }
        }

        private long checkStorage(String directory, long payloadSize) {
            long maxSize = properties.getTransfer().getMaxFileSizeBytes();
            if (payloadSize > maxSize) {
                throw InsufficientStorageException.sizeLimitExceeded(payloadSize, maxSize);
            }
            long available = storagePort.usableSpace(directory).join();
            long required = payloadSize * Math.max(1, properties.getTransfer().getStorageSafetyFactor());
            if (available < required) {
                throw new InsufficientStorageException(required, available);
            }
            return available;
        }

        private ContentRecord exportRecord(ContentRecord source, Set<String> favorites) {
            ContentRecord.ContentRecordBuilder builder = source.toBuilder()
                    .favorite(favorites.contains(source.getId()));
            if (options.anonymize()) {
                builder.content(anonymizer.anonymize(source.getContent()));
            }
            return builder.build();
        }

        private Map<String, Object> exportPreferences(Map<String, Object> source) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : source.entrySet()) {
                if (!options.includeCredentials() && PreferenceKeys.isCredential(entry.getKey())) {
                    continue;
                }
                result.put(entry.getKey(), entry.getValue());
            }
            return result;
        }

        private void enter(OperationPhase next, double fraction) {
            token.throwIfCancelled(OperationType.EXPORT, next);
            phase = next;
            tick(fraction);
        }

        private void tick(double fraction) {
            progress = Math.max(progress, fraction);
            sink.next(OperationProgress.of(OperationType.EXPORT, phase, progress, processed, total));
        }
    }

    private DeviceInfo currentDevice() {
        return DeviceInfo.builder()
                .platform(System.getProperty("os.name"))
                .osVersion(System.getProperty("os.version"))
                .appBuild(properties.getAppVersion())
                .build();
    }

    static UsageStatistics statistics(List<ContentRecord> records, Set<String> favorites) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        long intensitySum = 0;
        Instant earliest = null;
        Instant latest = null;
        for (ContentRecord contentRecord : records) {
            breakdown.merge(contentRecord.getCategory(), 1, Integer::sum);
            intensitySum += contentRecord.getIntensity();
            Instant createdAt = contentRecord.getCreatedAt();
            if (createdAt != null) {
                earliest = earliest == null || createdAt.isBefore(earliest) ? createdAt : earliest;
                latest = latest == null || createdAt.isAfter(latest) ? createdAt : latest;
            }
        }

        String mostPopular = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : breakdown.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                mostPopular = entry.getKey();
            }
        }

        return UsageStatistics.builder()
                .totalRecords(records.size())
                .totalFavorites(favorites.size())
                .categoryBreakdown(breakdown)
                .averageIntensity(records.isEmpty() ? 0.0 : (double) intensitySum / records.size())
                .mostPopularCategory(mostPopular)
                .earliestRecord(earliest)
                .latestRecord(latest)
                .build();
    }
}
