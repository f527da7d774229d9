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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Complete, versioned copy of the user's local state.
 *
 * <p>
 * Produced by export, consumed by import. {@code schemaVersion} is always
 * present; optional parts ({@code deviceInfo}, {@code usageStatistics}) are
 * {@code null} when not exported, collections are empty rather than absent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Snapshot {

    private int schemaVersion;

    private String appVersion;

    private Instant exportTimestamp;

    private DeviceInfo deviceInfo;

    private UsageStatistics usageStatistics;

    @Builder.Default
    private Map<String, Object> preferences = new LinkedHashMap<>();

    @Builder.Default
    private Set<String> favoriteIds = new LinkedHashSet<>();

    @Builder.Default
    private List<ContentRecord> contentRecords = new ArrayList<>();
}
