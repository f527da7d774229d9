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
 * A non-fatal anomaly.
 *
 * @param type
 *            anomaly kind
 * @param itemId
 *            affected record or favorite id, {@code null} for aggregate
 *            warnings
 * @param detail
 *            raw offending value or count, rendered by the presentation layer
 */
public record ImportWarning(ImportWarningType type, String itemId, String detail) {

    public static ImportWarning of(ImportWarningType type, String detail) {
        return new ImportWarning(type, null, detail);
    }

    public static ImportWarning forItem(ImportWarningType type, String itemId, String detail) {
        return new ImportWarning(type, itemId, detail);
    }
}
