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
 * A merge import hit its error budget. Records listed in
 * {@link #getCommittedIds()} stay in the store.
 */
public class PartialImportExceededException extends DataTransferException {

    private static final long serialVersionUID = 1L;

    private final int errorsEncountered;
    private final List<String> committedIds;
    private final List<String> notCommittedIds;

    public PartialImportExceededException(int errorsEncountered, List<String> committedIds,
            List<String> notCommittedIds) {
        super(ErrorKind.PARTIAL_IMPORT_EXCEEDED, "Import aborted after " + errorsEncountered + " errors ("
                + committedIds.size() + " committed, " + notCommittedIds.size() + " not committed)");
        this.errorsEncountered = errorsEncountered;
        this.committedIds = List.copyOf(committedIds);
        this.notCommittedIds = List.copyOf(notCommittedIds);
    }

    public int getErrorsEncountered() {
        return errorsEncountered;
    }

    public List<String> getCommittedIds() {
        return committedIds;
    }

    public List<String> getNotCommittedIds() {
        return notCommittedIds;
    }

    @Override
    public List<Object> getMessageArguments() {
        return List.of(errorsEncountered, committedIds.size(), notCommittedIds.size());
    }
}
