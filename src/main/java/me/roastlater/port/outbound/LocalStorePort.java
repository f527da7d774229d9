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

package me.roastlater.port.outbound;

import me.roastlater.domain.model.ContentRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Port for the application's local state: content records, the favorite id
 * set and the preference map.
 *
 * <p>
 * Every method returns or accepts detached copies. Implementations raise
 * {@link me.roastlater.domain.exception.StoreAccessException} when the
 * underlying storage cannot be read or written.
 */
public interface LocalStorePort {

    /**
     * All records in insertion order, with {@code favorite} flags matching
     * {@link #readFavoriteIds()}.
     */
    List<ContentRecord> readAllRecords();

    Set<String> readFavoriteIds();

    Map<String, Object> readPreferences();

    /**
     * Insert or overwrite records by id. Does not touch favorites.
     */
    void upsertRecords(Collection<ContentRecord> records);

    /**
     * Replace the whole record collection.
     */
    void writeAllRecords(List<ContentRecord> records);

    void writeFavoriteIds(Set<String> favoriteIds);

    void writePreferences(Map<String, Object> preferences);

    /**
     * Remove all records and favorites. Preferences are kept.
     */
    void clearRecordsAndFavorites();
}
