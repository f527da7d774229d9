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
 * Groups of data an export may contain.
 */
public enum DataCategory {

    CONTENT_RECORDS(Severity.MEDIUM),

    FAVORITES(Severity.LOW),

    PREFERENCES(Severity.LOW),

    EXPORT_METADATA(Severity.LOW),

    CREDENTIALS(Severity.HIGH),

    DEVICE_INFO(Severity.LOW),

    USAGE_STATISTICS(Severity.LOW);

    private final Severity sensitivity;

    DataCategory(Severity sensitivity) {
        this.sensitivity = sensitivity;
    }

    public Severity getSensitivity() {
        return sensitivity;
    }

    public String messageKey() {
        return "transfer.category." + name().toLowerCase(Locale.ROOT);
    }
}
