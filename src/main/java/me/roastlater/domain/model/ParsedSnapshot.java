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

import java.util.List;

/**
 * Output of the import parser.
 *
 * @param snapshot
 *            the snapshot, migrated to the current schema
 * @param sourceSchemaVersion
 *            schema version found in the payload
 * @param compatible
 *            false when the payload was written by an older schema; the import
 *            can still continue
 * @param warnings
 *            anomalies found while decoding (e.g. malformed timestamps)
 */
public record ParsedSnapshot(
        Snapshot snapshot,
        int sourceSchemaVersion,
        boolean compatible,
        List<ImportWarning> warnings) {

    public ParsedSnapshot {
        warnings = List.copyOf(warnings);
    }
}
