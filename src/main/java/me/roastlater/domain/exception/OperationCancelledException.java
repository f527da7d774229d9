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
import me.roastlater.domain.model.OperationPhase;
import me.roastlater.domain.model.OperationType;

import java.util.List;

public class OperationCancelledException extends DataTransferException {

    private static final long serialVersionUID = 1L;

    private final OperationType operation;
    private final OperationPhase phase;

    public OperationCancelledException(OperationType operation, OperationPhase phase) {
        super(ErrorKind.OPERATION_CANCELLED, operation + " cancelled during " + phase);
        this.operation = operation;
        this.phase = phase;
    }

    public OperationType getOperation() {
        return operation;
    }

    public OperationPhase getPhase() {
        return phase;
    }

    @Override
    public List<Object> getMessageArguments() {
        return List.of(operation.name(), phase.name());
    }
}
