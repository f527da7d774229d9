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
 * Base of all failures raised by the export and import pipelines. Carries the
 * taxonomy entry and the arguments the presentation layer needs to render a
 * localized message.
 */
public class DataTransferException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public DataTransferException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DataTransferException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Message format arguments, in the order the localized message expects.
     */
    public List<Object> getMessageArguments() {
        return List.of();
    }
}
