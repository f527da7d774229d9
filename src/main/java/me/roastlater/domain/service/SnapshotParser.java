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
import me.roastlater.domain.model.ContentRecord;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.ImportWarningType;
import me.roastlater.domain.model.ParsedSnapshot;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns an import payload into a validated snapshot. Either a complete
 * {@link ParsedSnapshot} comes back or an exception is thrown; nothing is
 * partially accepted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotParser {

    private final SnapshotCodec codec;
    private final RoastLaterProperties properties;

    /**
     * @throws me.roastlater.domain.exception.CorruptedDataException
     *             for empty, oversize or malformed payloads and duplicate record
     *             ids
     * @throws me.roastlater.domain.exception.VersionMismatchException
     *             for payloads written by a newer schema
     */
    public ParsedSnapshot parse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new CorruptedDataException("$", "empty payload");
        }
        long maxSize = properties.getTransfer().getMaxFileSizeBytes();
        if (payload.length > maxSize) {
            throw new CorruptedDataException("$", "payload of " + payload.length + " bytes exceeds " + maxSize);
        }

        ParsedSnapshot decoded = codec.decode(payload);
        rejectDuplicateIds(decoded.snapshot().getContentRecords());

        List<ImportWarning> warnings = new ArrayList<>(decoded.warnings());
        if (!decoded.compatible()) {
            warnings.add(0, ImportWarning.of(ImportWarningType.SCHEMA_VERSION_MISMATCH,
                    decoded.sourceSchemaVersion() + "->" + SnapshotCodec.CURRENT_SCHEMA_VERSION));
            log.info("[Import] Migrated snapshot from schema version {} to {}",
                    decoded.sourceSchemaVersion(), SnapshotCodec.CURRENT_SCHEMA_VERSION);
        }

        log.info("[Import] Parsed snapshot: {} records, {} favorites, {} preferences",
                decoded.snapshot().getContentRecords().size(),
                decoded.snapshot().getFavoriteIds().size(),
                decoded.snapshot().getPreferences().size());
        return new ParsedSnapshot(decoded.snapshot(), decoded.sourceSchemaVersion(), decoded.compatible(), warnings);
    }

    private void rejectDuplicateIds(List<ContentRecord> records) {
        Set<String> seen = new HashSet<>();
        for (ContentRecord contentRecord : records) {
            if (!seen.add(contentRecord.getId())) {
                throw new CorruptedDataException("contentRecords.id", "duplicate id " + contentRecord.getId());
            }
        }
    }
}
