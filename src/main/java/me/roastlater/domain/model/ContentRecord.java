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

/**
 * A single generated snippet as stored locally and as carried inside a
 * {@link Snapshot}.
 *
 * <p>
 * Identity is defined by {@link #id} alone. Two records with the same content
 * but different ids are distinct records (at most a "likely duplicate").
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContentRecord {

    public static final int MIN_INTENSITY = 1;
    public static final int MAX_INTENSITY = 5;

    private String id;

    private String content;

    /** Category tag, normally one of {@link ContentCategory} values. */
    private String category;

    private int intensity;

    @Builder.Default
    private String language = "en";

    private Instant createdAt;

    private boolean favorite;

    public boolean hasIntensityInRange() {
        return intensity >= MIN_INTENSITY && intensity <= MAX_INTENSITY;
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }
}
