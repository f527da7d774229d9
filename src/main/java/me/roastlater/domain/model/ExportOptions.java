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

/**
 * Inclusion policy of one export request. Never persisted.
 *
 * @param includeCredentials
 *            export API key and endpoint preferences
 * @param includeDeviceInfo
 *            export platform and OS version
 * @param includeUsageStatistics
 *            export aggregate counts
 * @param anonymize
 *            redact identifying substrings from record content (best effort)
 */
public record ExportOptions(
        boolean includeCredentials,
        boolean includeDeviceInfo,
        boolean includeUsageStatistics,
        boolean anonymize) {

    public static ExportOptions defaults() {
        return new ExportOptions(false, true, true, false);
    }

    public static ExportOptions secure() {
        return new ExportOptions(false, false, true, true);
    }

    public static ExportOptions minimal() {
        return new ExportOptions(false, false, false, false);
    }
}
