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

import java.util.Locale;

/**
 * Anomalies found while previewing or applying an import.
 */
public enum ImportWarningType {

    DUPLICATE_RECORD,

    LIKELY_DUPLICATE,

    INTENSITY_OUT_OF_RANGE,

    EMPTY_CONTENT,

    UNSUPPORTED_CATEGORY,

    FUTURE_TIMESTAMP,

    MALFORMED_TIMESTAMP,

    ORPHAN_FAVORITE,

    CREDENTIALS_INCLUDED,

    SCHEMA_VERSION_MISMATCH,

    /** A record failed to apply during merge and was counted against the error budget. */
    RECORD_REJECTED;

    public String messageKey() {
        return "transfer.warning." + name().toLowerCase(Locale.ROOT);
    }
}
