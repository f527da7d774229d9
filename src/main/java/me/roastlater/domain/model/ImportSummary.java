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

package me.roastlater.domain.model;

import java.util.Map;

/**
 * Counts computed by the preview.
 *
 * @param totalRecords
 *            records in the snapshot
 * @param newRecords
 *            records whose id is not present locally
 * @param duplicateRecords
 *            records whose id is already present locally
 * @param likelyDuplicateRecords
 *            records with the same content and category as another record
 *            (reported only, never skipped)
 * @param invalidRecords
 *            records that would fail to apply (empty content or intensity out
 *            of range)
 * @param totalFavorites
 *            favorite ids in the snapshot
 * @param newFavorites
 *            favorite ids not favorited locally
 * @param categoryBreakdown
 *            category tag to count, over new records
 */
public record ImportSummary(
        int totalRecords,
        int newRecords,
        int duplicateRecords,
        int likelyDuplicateRecords,
        int invalidRecords,
        int totalFavorites,
        int newFavorites,
        Map<String, Integer> categoryBreakdown) {

    public ImportSummary {
        categoryBreakdown = Map.copyOf(categoryBreakdown);
    }
}
