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
import me.roastlater.domain.model.ContentCategory;
import me.roastlater.domain.model.ContentRecord;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.ImportWarningType;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Per-record checks shared by the export validation, the import preview and
 * the merge engine.
 */
@Component
@RequiredArgsConstructor
public class RecordInspector {

    private final RoastLaterProperties properties;

    /**
     * A record can be written to the store when its content is not blank and its
     * intensity is within range.
     */
    public boolean isApplicable(ContentRecord contentRecord) {
        return contentRecord.hasContent() && contentRecord.hasIntensityInRange();
    }

    /**
     * Anomalies of a single record, relative to {@code now}.
     */
    public List<ImportWarning> inspect(ContentRecord contentRecord, Instant now) {
        List<ImportWarning> warnings = new ArrayList<>();
        String id = contentRecord.getId();
        if (!contentRecord.hasContent()) {
            warnings.add(ImportWarning.forItem(ImportWarningType.EMPTY_CONTENT, id, null));
        }
        if (!contentRecord.hasIntensityInRange()) {
            warnings.add(ImportWarning.forItem(ImportWarningType.INTENSITY_OUT_OF_RANGE, id,
                    String.valueOf(contentRecord.getIntensity())));
        }
        if (!ContentCategory.isKnown(contentRecord.getCategory())) {
            warnings.add(ImportWarning.forItem(ImportWarningType.UNSUPPORTED_CATEGORY, id,
                    contentRecord.getCategory()));
        }
        Instant createdAt = contentRecord.getCreatedAt();
        if (createdAt != null && createdAt.isAfter(now.plus(properties.getTransfer().getFutureTimestampTolerance()))) {
            warnings.add(ImportWarning.forItem(ImportWarningType.FUTURE_TIMESTAMP, id, createdAt.toString()));
        }
        return warnings;
    }

    /**
     * Key used to detect likely duplicates: trimmed, case-folded content with
     * collapsed whitespace, plus the category tag.
     */
    public String similarityKey(ContentRecord contentRecord) {
        String content = contentRecord.getContent() == null ? ""
                : contentRecord.getContent().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return contentRecord.getCategory() + "|" + content;
    }
}
