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
 * One observation of a running operation.
 *
 * <p>
 * The last value seen before the stream terminates is authoritative: a
 * {@link OperationPhase#COMPLETED} value carries the {@code result}, a
 * {@link OperationPhase#FAILED} value carries the {@code failure} report.
 *
 * @param <T>
 *            operation result type
 */
public record OperationProgress<T>(
        OperationType operation,
        OperationPhase phase,
        double progress,
        int itemsProcessed,
        int totalItems,
        String messageKey,
        T result,
        ErrorReport failure) {

    public static <T> OperationProgress<T> of(OperationType operation, OperationPhase phase, double progress,
            int itemsProcessed, int totalItems) {
        return new OperationProgress<>(operation, phase, clamp(progress), itemsProcessed, totalItems,
                phase.messageKey(operation), null, null);
    }

    public static <T> OperationProgress<T> completed(OperationType operation, T result, int totalItems) {
        return new OperationProgress<>(operation, OperationPhase.COMPLETED, 1.0, totalItems, totalItems,
                OperationPhase.COMPLETED.messageKey(operation), result, null);
    }

    public static <T> OperationProgress<T> failed(OperationType operation, double progress, int itemsProcessed,
            int totalItems, ErrorReport failure) {
        return new OperationProgress<>(operation, OperationPhase.FAILED, clamp(progress), itemsProcessed, totalItems,
                failure.classification().messageKey(), null, failure);
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }

    private static double clamp(double value) {
        if (value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
