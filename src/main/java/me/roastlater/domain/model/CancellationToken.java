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

import java.util.concurrent.atomic.AtomicBoolean;

import me.roastlater.domain.exception.OperationCancelledException;

/**
 * Cooperative cancellation flag for one operation. Pipelines poll it between
 * items and phases.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * @return true if this call flipped the flag
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(OperationType operation, OperationPhase phase) {
        if (cancelled.get()) {
            throw new OperationCancelledException(operation, phase);
        }
    }
}
