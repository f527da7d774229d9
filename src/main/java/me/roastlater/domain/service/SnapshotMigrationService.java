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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.roastlater.domain.exception.VersionMismatchException;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Upgrades decoded snapshot documents written by an older schema to the
 * current one, one version step at a time.
 *
 * <p>
 * Version 1 to 2:
 * <ul>
 * <li>record field {@code spiceLevel} renamed to {@code intensity}</li>
 * <li>record {@code language} defaults to {@code "en"}</li>
 * <li>absent {@code deviceInfo} and {@code usageStatistics} become
 * {@code null}</li>
 * </ul>
 */
@Service
@Slf4j
public class SnapshotMigrationService {

    private static final String FIELD_SCHEMA_VERSION = "schemaVersion";
    private static final String FIELD_RECORDS = "contentRecords";
    private static final String LEGACY_INTENSITY = "spiceLevel";
    private static final String DEFAULT_LANGUAGE = "en";

    private final Map<Integer, UnaryOperator<ObjectNode>> steps = Map.of(
            1, SnapshotMigrationService::migrateV1ToV2);

    /**
     * Migrates {@code root} in place from {@code fromVersion} to
     * {@link SnapshotCodec#CURRENT_SCHEMA_VERSION}.
     *
     * @throws VersionMismatchException
     *             if no migration path exists
     */
    public ObjectNode migrate(ObjectNode root, int fromVersion) {
        ObjectNode current = root;
        int version = fromVersion;
        while (version < SnapshotCodec.CURRENT_SCHEMA_VERSION) {
            UnaryOperator<ObjectNode> step = steps.get(version);
            if (step == null) {
                throw new VersionMismatchException(fromVersion, SnapshotCodec.CURRENT_SCHEMA_VERSION);
            }
            current = step.apply(current);
            version++;
            current.put(FIELD_SCHEMA_VERSION, version);
            log.debug("[Import] Migrated snapshot document to schema version {}", version);
        }
        if (version != SnapshotCodec.CURRENT_SCHEMA_VERSION) {
            throw new VersionMismatchException(fromVersion, SnapshotCodec.CURRENT_SCHEMA_VERSION);
        }
        return current;
    }

    public boolean canMigrate(int fromVersion) {
        int version = fromVersion;
        while (version < SnapshotCodec.CURRENT_SCHEMA_VERSION) {
            if (!steps.containsKey(version)) {
                return false;
            }
            version++;
        }
        return version == SnapshotCodec.CURRENT_SCHEMA_VERSION;
    }

    private static ObjectNode migrateV1ToV2(ObjectNode root) {
        JsonNode records = root.get(FIELD_RECORDS);
        if (records != null && records.isArray()) {
            for (JsonNode recordNode : records) {
                if (!(recordNode instanceof ObjectNode objectNode)) {
                    continue;
                }
                if (objectNode.has(LEGACY_INTENSITY) && !objectNode.has("intensity")) {
                    objectNode.set("intensity", objectNode.get(LEGACY_INTENSITY));
                }
                objectNode.remove(LEGACY_INTENSITY);
                if (!objectNode.has("language")) {
                    objectNode.put("language", DEFAULT_LANGUAGE);
                }
            }
        }
        if (!root.has("deviceInfo")) {
            root.putNull("deviceInfo");
        }
        if (!root.has("usageStatistics")) {
            root.putNull("usageStatistics");
        }
        return root;
    }
}
