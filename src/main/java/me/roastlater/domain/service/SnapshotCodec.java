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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.roastlater.domain.exception.CorruptedDataException;
import me.roastlater.domain.exception.SerializationFailedException;
import me.roastlater.domain.exception.VersionMismatchException;
import me.roastlater.domain.model.ContentRecord;
import me.roastlater.domain.model.DeviceInfo;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.ImportWarningType;
import me.roastlater.domain.model.ParsedSnapshot;
import me.roastlater.domain.model.Snapshot;
import me.roastlater.domain.model.UsageStatistics;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Serializes snapshots to the interchange file format and back.
 *
 * <p>
 * The file is UTF-8 pretty-printed JSON holding every snapshot field (absent
 * optional values as {@code null}, collections as empty) followed by a
 * {@code checksum} field: the SHA-256 hex digest of the compact JSON of all
 * other fields. The checksum belongs to the file, not to the snapshot value.
 *
 * <p>
 * Decoding checks the schema version before anything else, then the checksum
 * (when present), then migrates older documents and binds the fields.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotCodec {

    public static final int CURRENT_SCHEMA_VERSION = 2;
    public static final int MIN_SUPPORTED_SCHEMA_VERSION = 1;

    static final String FIELD_CHECKSUM = "checksum";
    private static final String FIELD_SCHEMA_VERSION = "schemaVersion";
    private static final String FIELD_RECORDS = "contentRecords";
    private static final String FIELD_FAVORITES = "favoriteIds";
    private static final String FIELD_PREFERENCES = "preferences";
    private static final String DEFAULT_LANGUAGE = "en";

    private static final TypeReference<LinkedHashMap<String, Object>> PREFERENCE_MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final SnapshotMigrationService migrationService;
    private final Clock clock;

    /**
     * Serialized file bytes together with the embedded checksum.
     */
    public record EncodedSnapshot(byte[] payload, String checksum) {
    }

    // ==================== Encoding ====================

    public EncodedSnapshot encode(Snapshot snapshot) {
        try {
            ObjectNode body = objectMapper.valueToTree(snapshot);
            String checksum = checksum(body);
            body.put(FIELD_CHECKSUM, checksum);
            byte[] payload = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(body);
            return new EncodedSnapshot(payload, checksum);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SerializationFailedException("Failed to serialize snapshot", e);
        }
    }

    public byte[] serialize(Snapshot snapshot) {
        return encode(snapshot).payload();
    }

    // ==================== Decoding ====================

    /**
     * Decodes a snapshot file.
     *
     * @throws CorruptedDataException
     *             if the payload is not a structurally valid snapshot
     * @throws VersionMismatchException
     *             if the payload was written by a newer schema
     */
    public ParsedSnapshot decode(byte[] payload) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new CorruptedDataException("$", "not valid JSON", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new CorruptedDataException("$", "root is not an object");
        }
        ObjectNode root = (ObjectNode) tree;

        int sourceVersion = readSchemaVersion(root);
        verifyChecksum(root);

        if (sourceVersion < CURRENT_SCHEMA_VERSION) {
            root = migrationService.migrate(root, sourceVersion);
        }

        List<ImportWarning> warnings = new ArrayList<>();
        Snapshot snapshot = bind(root, warnings);
        return new ParsedSnapshot(snapshot, sourceVersion, sourceVersion == CURRENT_SCHEMA_VERSION, warnings);
    }

    public Snapshot deserialize(byte[] payload) {
        return decode(payload).snapshot();
    }

    private int readSchemaVersion(ObjectNode root) {
        JsonNode versionNode = root.get(FIELD_SCHEMA_VERSION);
        if (versionNode == null || !versionNode.isInt()) {
            throw new CorruptedDataException(FIELD_SCHEMA_VERSION, "missing or not an integer");
        }
        int version = versionNode.intValue();
        if (version > CURRENT_SCHEMA_VERSION) {
            throw new VersionMismatchException(version, CURRENT_SCHEMA_VERSION);
        }
        if (version < MIN_SUPPORTED_SCHEMA_VERSION) {
            throw new CorruptedDataException(FIELD_SCHEMA_VERSION, "unsupported version " + version);
        }
        return version;
    }

    private void verifyChecksum(ObjectNode root) {
        JsonNode checksumNode = root.remove(FIELD_CHECKSUM);
        if (checksumNode == null || checksumNode.isNull()) {
            log.debug("[Import] Snapshot carries no checksum");
            return;
        }
        if (!checksumNode.isTextual()) {
            throw new CorruptedDataException(FIELD_CHECKSUM, "not a string");
        }
        String expected;
        try {
            expected = checksum(root);
        } catch (JsonProcessingException e) {
            throw new CorruptedDataException(FIELD_CHECKSUM, "cannot be verified", e);
        }
        if (!expected.equalsIgnoreCase(checksumNode.textValue())) {
            throw new CorruptedDataException(FIELD_CHECKSUM, "mismatch");
        }
    }

    private Snapshot bind(ObjectNode root, List<ImportWarning> warnings) {
        Instant importTime = clock.instant();
        return Snapshot.builder()
                .schemaVersion(CURRENT_SCHEMA_VERSION)
                .appVersion(requireText(root, "appVersion"))
                .exportTimestamp(requireInstant(root, "exportTimestamp"))
                .deviceInfo(bindOptional(root, "deviceInfo", DeviceInfo.class))
                .usageStatistics(bindOptional(root, "usageStatistics", UsageStatistics.class))
                .preferences(bindPreferences(root))
                .favoriteIds(bindFavorites(root))
                .contentRecords(bindRecords(root, importTime, warnings))
                .build();
    }

    private List<ContentRecord> bindRecords(ObjectNode root, Instant importTime, List<ImportWarning> warnings) {
        JsonNode records = root.get(FIELD_RECORDS);
        if (records == null || !records.isArray()) {
            throw new CorruptedDataException(FIELD_RECORDS, "missing or not an array");
        }
        List<ContentRecord> result = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            JsonNode node = records.get(i);
            String path = FIELD_RECORDS + "[" + i + "]";
            if (!node.isObject()) {
                throw new CorruptedDataException(path, "not an object");
            }
            String id = requireText(node, path, "id");
            if (id.isBlank()) {
                throw new CorruptedDataException(path + ".id", "blank");
            }
            JsonNode intensity = node.get("intensity");
            if (intensity == null || !intensity.isInt()) {
                throw new CorruptedDataException(path + ".intensity", "missing or not an integer");
            }
            JsonNode favorite = node.get("favorite");
            if (favorite != null && !favorite.isNull() && !favorite.isBoolean()) {
                throw new CorruptedDataException(path + ".favorite", "not a boolean");
            }
            result.add(ContentRecord.builder()
                    .id(id)
                    .content(requireText(node, path, "content"))
                    .category(requireText(node, path, "category"))
                    .intensity(intensity.intValue())
                    .language(readLanguage(node, path))
                    .createdAt(readCreatedAt(node, id, importTime, warnings))
                    .favorite(favorite != null && favorite.booleanValue())
                    .build());
        }
        return result;
    }

    private String readLanguage(JsonNode node, String path) {
        JsonNode language = node.get("language");
        if (language == null) {
            return DEFAULT_LANGUAGE;
        }
        if (language.isNull()) {
            return null;
        }
        if (!language.isTextual()) {
            throw new CorruptedDataException(path + ".language", "not a string");
        }
        return language.textValue();
    }

    private Instant readCreatedAt(JsonNode node, String id, Instant importTime, List<ImportWarning> warnings) {
        JsonNode createdAt = node.get("createdAt");
        String raw = createdAt == null || createdAt.isNull() ? null : createdAt.asText();
        if (raw != null) {
            try {
                return Instant.parse(raw);
            } catch (DateTimeParseException e) {
                log.debug("[Import] Malformed timestamp on record {}", id);
            }
        }
        warnings.add(ImportWarning.forItem(ImportWarningType.MALFORMED_TIMESTAMP, id, raw));
        return importTime;
    }

    private Set<String> bindFavorites(ObjectNode root) {
        JsonNode favorites = root.get(FIELD_FAVORITES);
        if (favorites == null || !favorites.isArray()) {
            throw new CorruptedDataException(FIELD_FAVORITES, "missing or not an array");
        }
        Set<String> result = new LinkedHashSet<>();
        for (int i = 0; i < favorites.size(); i++) {
            JsonNode id = favorites.get(i);
            if (!id.isTextual()) {
                throw new CorruptedDataException(FIELD_FAVORITES + "[" + i + "]", "not a string");
            }
            result.add(id.textValue());
        }
        return result;
    }

    private Map<String, Object> bindPreferences(ObjectNode root) {
        JsonNode preferences = root.get(FIELD_PREFERENCES);
        if (preferences == null || !preferences.isObject()) {
            throw new CorruptedDataException(FIELD_PREFERENCES, "missing or not an object");
        }
        return objectMapper.convertValue(preferences, PREFERENCE_MAP);
    }

    private <T> T bindOptional(ObjectNode root, String field, Class<T> type) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new CorruptedDataException(field, "not an object");
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptedDataException(field, "invalid structure", e);
        }
    }

    private static String requireText(JsonNode node, String field) {
        return requireText(node, null, field);
    }

    private static String requireText(JsonNode node, String parentPath, String field) {
        JsonNode value = node.get(field);
        String path = parentPath != null ? parentPath + "." + field : field;
        if (value == null || !value.isTextual()) {
            throw new CorruptedDataException(path, "missing or not a string");
        }
        return value.textValue();
    }

    private static Instant requireInstant(JsonNode node, String field) {
        String text = requireText(node, field);
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new CorruptedDataException(field, "not an ISO-8601 timestamp", e);
        }
    }

    // ==================== Checksum ====================

    private String checksum(ObjectNode body) throws JsonProcessingException {
        byte[] compact = objectMapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
        return sha256Hex(compact);
    }

    static String sha256Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
