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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts over the exported records.
 *
 * <p>
 * Derived data only: importing ignores it apart from showing it in the
 * preview.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageStatistics {

    private int totalRecords;

    private int totalFavorites;

    /** Category tag to record count. */
    @Builder.Default
    private Map<String, Integer> categoryBreakdown = new LinkedHashMap<>();

    private double averageIntensity;

    private String mostPopularCategory;

    private Instant earliestRecord;

    private Instant latestRecord;
}
