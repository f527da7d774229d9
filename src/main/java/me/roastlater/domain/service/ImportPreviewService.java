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
import me.roastlater.domain.model.ContentRecord;
import me.roastlater.domain.model.ImportPreview;
import me.roastlater.domain.model.ImportSource;
import me.roastlater.domain.model.ImportSummary;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.ImportWarningType;
import me.roastlater.domain.model.ParsedSnapshot;
import me.roastlater.domain.model.PreferenceChange;
import me.roastlater.domain.model.PreferenceKeys;
import me.roastlater.domain.model.Snapshot;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.port.outbound.LocalStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Computes what an import would change without touching the store.
 *
 * <p>
 * A record is a duplicate when its id already exists locally. A record that is
 * not a duplicate is a likely duplicate when its normalized content and
 * category match an earlier record of the same snapshot, or a local record
 * with another id created within the configured window. Warnings never abort
 * the preview.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportPreviewService {

    static final String MASKED_VALUE = "***";

    private final LocalStorePort localStore;
    private final RecordInspector inspector;
    private final RoastLaterProperties properties;
    private final Clock clock;

    public ImportPreview buildPreview(ParsedSnapshot parsed) {
        Snapshot snapshot = parsed.snapshot();
        List<ContentRecord> localRecords = localStore.readAllRecords();
        Set<String> localFavorites = localStore.readFavoriteIds();
        Map<String, Object> localPreferences = localStore.readPreferences();
        Instant now = clock.instant();

        Map<String, ContentRecord> localById = new HashMap<>();
        Map<String, List<ContentRecord>> localBySimilarity = new HashMap<>();
        for (ContentRecord localRecord : localRecords) {
            localById.put(localRecord.getId(), localRecord);
            localBySimilarity.computeIfAbsent(inspector.similarityKey(localRecord), key -> new ArrayList<>())
                    .add(localRecord);
        }

        List<ImportWarning> warnings = new ArrayList<>(parsed.warnings());
        Map<String, String> seenInSnapshot = new HashMap<>();
        Map<String, Integer> categoryBreakdown = new LinkedHashMap<>();
        Set<String> incomingIds = snapshot.getContentRecords().stream()
                .map(ContentRecord::getId)
                .collect(Collectors.toSet());
        int newRecords = 0;
        int duplicates = 0;
        int likelyDuplicates = 0;
        int invalid = 0;

        for (ContentRecord incoming : snapshot.getContentRecords()) {
            String similarityKey = inspector.similarityKey(incoming);
            if (localById.containsKey(incoming.getId())) {
                duplicates++;
            } else {
                newRecords++;
                categoryBreakdown.merge(incoming.getCategory(), 1, Integer::sum);
                String match = findLikelyDuplicate(incoming, similarityKey, seenInSnapshot, localBySimilarity);
                if (match != null) {
                    likelyDuplicates++;
                    warnings.add(ImportWarning.forItem(ImportWarningType.LIKELY_DUPLICATE, incoming.getId(), match));
                }
            }
            seenInSnapshot.putIfAbsent(similarityKey, incoming.getId());

            if (!inspector.isApplicable(incoming)) {
                invalid++;
            }
            warnings.addAll(inspector.inspect(incoming, now));
        }
        if (duplicates > 0) {
            warnings.add(ImportWarning.of(ImportWarningType.DUPLICATE_RECORD, String.valueOf(duplicates)));
        }

        int newFavorites = 0;
        for (String favoriteId : snapshot.getFavoriteIds()) {
            if (!localFavorites.contains(favoriteId)) {
                newFavorites++;
            }
            if (!incomingIds.contains(favoriteId) && !localById.containsKey(favoriteId)) {
                warnings.add(ImportWarning.forItem(ImportWarningType.ORPHAN_FAVORITE, favoriteId, null));
            }
        }

        long credentialKeys = snapshot.getPreferences().keySet().stream()
                .filter(PreferenceKeys::isCredential)
                .count();
        if (credentialKeys > 0) {
            warnings.add(ImportWarning.of(ImportWarningType.CREDENTIALS_INCLUDED, String.valueOf(credentialKeys)));
        }

        ImportSummary summary = new ImportSummary(
                snapshot.getContentRecords().size(),
                newRecords,
                duplicates,
                likelyDuplicates,
                invalid,
                snapshot.getFavoriteIds().size(),
                newFavorites,
                categoryBreakdown);

        ImportPreview preview = new ImportPreview(
                UUID.randomUUID().toString(),
                new ImportSource(snapshot.getAppVersion(), parsed.sourceSchemaVersion(),
                        snapshot.getExportTimestamp(), snapshot.getDeviceInfo()),
                parsed.compatible(),
                summary,
                warnings,
                preferenceChanges(localPreferences, snapshot.getPreferences()),
                now);

        log.info("[Import] Preview {}: {} records ({} new, {} duplicate, {} likely duplicate, {} invalid), "
                + "{} warnings", preview.previewId(), summary.totalRecords(), newRecords, duplicates,
                likelyDuplicates, invalid, warnings.size());
        return preview;
    }

    /**
     * Incoming keys whose value differs from the local one. Credential values
     * are masked.
     */
    static List<PreferenceChange> preferenceChanges(Map<String, Object> local, Map<String, Object> incoming) {
        List<PreferenceChange> changes = new ArrayList<>();
        for (Map.Entry<String, Object> entry : incoming.entrySet()) {
            String key = entry.getKey();
            Object oldValue = local.get(key);
            if (Objects.equals(oldValue, entry.getValue())) {
                continue;
            }
            if (PreferenceKeys.isCredential(key)) {
                changes.add(new PreferenceChange(key, oldValue == null ? null : MASKED_VALUE,
                        entry.getValue() == null ? null : MASKED_VALUE));
            } else {
                changes.add(new PreferenceChange(key, oldValue, entry.getValue()));
            }
        }
        return changes;
    }

    private String findLikelyDuplicate(ContentRecord incoming, String similarityKey,
            Map<String, String> seenInSnapshot, Map<String, List<ContentRecord>> localBySimilarity) {
        String earlier = seenInSnapshot.get(similarityKey);
        if (earlier != null) {
            return earlier;
        }
        Duration window = properties.getTransfer().getLikelyDuplicateWindow();
        for (ContentRecord localRecord : localBySimilarity.getOrDefault(similarityKey, List.of())) {
            if (localRecord.getId().equals(incoming.getId())) {
                continue;
            }
            if (withinWindow(localRecord.getCreatedAt(), incoming.getCreatedAt(), window)) {
                return localRecord.getId();
            }
        }
        return null;
    }

    private static boolean withinWindow(Instant first, Instant second, Duration window) {
        if (first == null || second == null) {
            return false;
        }
        return Duration.between(first, second).abs().compareTo(window) <= 0;
    }
}
