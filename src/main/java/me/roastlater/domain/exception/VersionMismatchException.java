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
 * The snapshot was written by a schema version this build cannot read.
 */
public class VersionMismatchException extends DataTransferException {

    private static final long serialVersionUID = 1L;

    private final int found;
    private final int supported;

    public VersionMismatchException(int found, int supported) {
        super(ErrorKind.VERSION_MISMATCH,
                "Unsupported schema version " + found + " (supported up to " + supported + ")");
        this.found = found;
        this.supported = supported;
    }

    public int getFound() {
        return found;
    }

    public int getSupported() {
        return supported;
    }

    @Override
    public List<Object> getMessageArguments() {
        return List.of(found, supported);
    }
}
