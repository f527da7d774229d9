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

import java.time.Instant;
import java.util.List;

/**
 * Non-committing summary of what an import would change. Built fresh per
 * import attempt and discarded once the user confirms or cancels.
 */
public record ImportPreview(
        String previewId,
        ImportSource source,
        boolean compatible,
        ImportSummary summary,
        List<ImportWarning> warnings,
        List<PreferenceChange> preferenceChanges,
        Instant createdAt) {

    public ImportPreview {
        warnings = List.copyOf(warnings);
        preferenceChanges = List.copyOf(preferenceChanges);
    }

    public boolean hasWarnings(ImportWarningType type) {
        return warnings.stream().anyMatch(warning -> warning.type() == type);
    }
}
