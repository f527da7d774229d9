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
 * Named stages of export and import operations.
 *
 * <p>
 * Export runs PREPARING, COLLECTING_DATA, PROCESSING_RECORDS,
 * PROCESSING_FAVORITES, PROCESSING_PREFERENCES, GENERATING_METADATA,
 * SERIALIZING, WRITING, COMPLETED. Import runs PREPARING, VALIDATING,
 * PROCESSING_RECORDS, PROCESSING_FAVORITES, PROCESSING_PREFERENCES, SAVING,
 * COMPLETED. Either may end in FAILED instead.
 */
public enum OperationPhase {

    PREPARING,

    COLLECTING_DATA,

    VALIDATING,

    PROCESSING_RECORDS,

    PROCESSING_FAVORITES,

    PROCESSING_PREFERENCES,

    GENERATING_METADATA,

    SERIALIZING,

    WRITING,

    SAVING,

    COMPLETED,

    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String messageKey(OperationType operation) {
        return operation.messagePrefix() + ".phase." + name().toLowerCase(Locale.ROOT);
    }
}
