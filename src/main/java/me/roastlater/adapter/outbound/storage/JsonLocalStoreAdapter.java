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

package me.roastlater.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.roastlater.domain.exception.StoreAccessException;
import me.roastlater.domain.model.ContentRecord;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.port.outbound.LocalStorePort;
import me.roastlater.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link LocalStorePort} backed by three JSON documents in the store
 * directory:
 * <ul>
 * <li>records.json - content records in insertion order
 * <li>favorites.json - favorite record ids
 * <li>preferences.json - flat preference map
 * </ul>
 * Every write goes through {@link StoragePort#putTextAtomic}. Record
 * {@code favorite} flags are derived from the favorite set on read.
 */
@Component
@Slf4j
public class JsonLocalStoreAdapter implements LocalStorePort {

    static final String RECORDS_FILE = "records.json";
    static final String FAVORITES_FILE = "favorites.json";
    static final String PREFERENCES_FILE = "preferences.json";

    private static final TypeReference<List<ContentRecord>> RECORD_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Object>> PREFERENCE_MAP = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String storeDirectory;

    public JsonLocalStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper,
            RoastLaterProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.storeDirectory = properties.getStorage().getStoreDirectory();
    }

    @Override
    public synchronized List<ContentRecord> readAllRecords() {
        List<ContentRecord> records = readDocument(RECORDS_FILE, RECORD_LIST);
        if (records == null) {
            return new ArrayList<>();
        }
        Set<String> favorites = readFavoriteIds();
        for (ContentRecord contentRecord : records) {
            contentRecord.setFavorite(favorites.contains(contentRecord.getId()));
        }
        return records;
    }

    @Override
    public synchronized Set<String> readFavoriteIds() {
        List<String> ids = readDocument(FAVORITES_FILE, ID_LIST);
        return ids != null ? new LinkedHashSet<>(ids) : new LinkedHashSet<>();
    }

    @Override
    public synchronized Map<String, Object> readPreferences() {
        Map<String, Object> preferences = readDocument(PREFERENCES_FILE, PREFERENCE_MAP);
        return preferences != null ? preferences : new LinkedHashMap<>();
    }

    @Override
    public synchronized void upsertRecords(Collection<ContentRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        List<ContentRecord> existing = readAllRecords();
        Map<String, ContentRecord> byId = new LinkedHashMap<>();
        for (ContentRecord contentRecord : existing) {
            byId.put(contentRecord.getId(), contentRecord);
        }
        for (ContentRecord contentRecord : records) {
            byId.put(contentRecord.getId(), contentRecord.toBuilder().build());
        }
        writeDocument(RECORDS_FILE, new ArrayList<>(byId.values()));
        log.debug("[Storage] Upserted {} records", records.size());
    }

    @Override
    public synchronized void writeAllRecords(List<ContentRecord> records) {
        writeDocument(RECORDS_FILE, records);
    }

    @Override
    public synchronized void writeFavoriteIds(Set<String> favoriteIds) {
        writeDocument(FAVORITES_FILE, new ArrayList<>(favoriteIds));
    }

    @Override
    public synchronized void writePreferences(Map<String, Object> preferences) {
        writeDocument(PREFERENCES_FILE, preferences);
    }

    @Override
    public synchronized void clearRecordsAndFavorites() {
        writeDocument(RECORDS_FILE, List.of());
        writeDocument(FAVORITES_FILE, List.of());
        log.debug("[Storage] Cleared records and favorites");
    }

    private <T> T readDocument(String file, TypeReference<T> type) {
        String json;
        try {
            json = storagePort.getText(storeDirectory, file).join();
        } catch (RuntimeException e) {
            throw new StoreAccessException("Failed to read " + storeDirectory + "/" + file, e);
        }
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new StoreAccessException("Failed to parse " + storeDirectory + "/" + file, e);
        }
    }

    private void writeDocument(String file, Object document) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new StoreAccessException("Failed to serialize " + storeDirectory + "/" + file, e);
        }
        try {
            storagePort.putTextAtomic(storeDirectory, file, json, false).join();
        } catch (RuntimeException e) {
            throw new StoreAccessException("Failed to write " + storeDirectory + "/" + file, e);
        }
    }
}
