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

package me.roastlater.domain.exception;

import me.roastlater.domain.model.ErrorKind;

import java.util.List;

/**
 * The payload or one of its fields is structurally invalid.
 */
public class CorruptedDataException extends DataTransferException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String reason;

    public CorruptedDataException(String field, String reason) {
        super(ErrorKind.CORRUPTED_DATA, "Corrupted data in '" + field + "': " + reason);
        this.field = field;
        this.reason = reason;
    }

    public CorruptedDataException(String field, String reason, Throwable cause) {
        super(ErrorKind.CORRUPTED_DATA, "Corrupted data in '" + field + "': " + reason, cause);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public List<Object> getMessageArguments() {
        return List.of(field, reason);
    }
}
