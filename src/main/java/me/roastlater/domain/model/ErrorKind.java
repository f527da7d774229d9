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
 * Structured error taxonomy of the interchange subsystem. The presentation
 * layer turns a kind into localized text.
 */
public enum ErrorKind {

    CORRUPTED_DATA,

    VERSION_MISMATCH,

    INSUFFICIENT_STORAGE,

    SERIALIZATION_FAILED,

    PARTIAL_IMPORT_EXCEEDED,

    OPERATION_CANCELLED,

    /** The local store could not be read or written. */
    STORE_ACCESS,

    /** The target of the request is being used by a running operation. */
    OPERATION_IN_PROGRESS,

    /** An import was confirmed without a matching pending preview. */
    PREVIEW_NOT_FOUND,

    UNKNOWN;

    public String messageKey() {
        return "transfer.error." + name().toLowerCase(Locale.ROOT);
    }

    public String suggestionKey() {
        return "transfer.error." + name().toLowerCase(Locale.ROOT) + ".suggestion";
    }
}
