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
 * Not enough room to write the export, or the payload exceeds the size limit.
 * Sizes are in bytes.
 */
public class InsufficientStorageException extends DataTransferException {

    private static final long serialVersionUID = 1L;

    private final long required;
    private final long available;
    private final boolean sizeLimit;

    public InsufficientStorageException(long required, long available) {
        this(required, available, false, null);
    }

    public InsufficientStorageException(long required, long available, Throwable cause) {
        this(required, available, false, cause);
    }

    private InsufficientStorageException(long required, long available, boolean sizeLimit, Throwable cause) {
        super(ErrorKind.INSUFFICIENT_STORAGE, sizeLimit
                ? "Payload of " + required + " bytes exceeds the limit of " + available + " bytes"
                : "Insufficient storage: required " + required + " bytes, available " + available, cause);
        this.required = required;
        this.available = available;
        this.sizeLimit = sizeLimit;
    }

    /**
     * The payload is larger than the configured maximum file size. Freeing
     * storage does not help here.
     */
    public static InsufficientStorageException sizeLimitExceeded(long payloadSize, long maxSize) {
        return new InsufficientStorageException(payloadSize, maxSize, true, null);
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }

    public boolean isSizeLimit() {
        return sizeLimit;
    }

    @Override
    public List<Object> getMessageArguments() {
        return List.of(required, available);
    }
}
