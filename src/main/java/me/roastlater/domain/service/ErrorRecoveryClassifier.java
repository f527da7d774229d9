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

package me.roastlater.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.roastlater.domain.exception.DataTransferException;
import me.roastlater.domain.exception.InsufficientStorageException;
import me.roastlater.domain.model.ErrorClassification;
import me.roastlater.domain.model.ErrorKind;
import me.roastlater.domain.model.ErrorReport;
import me.roastlater.domain.model.OperationContext;
import me.roastlater.domain.model.RecoveryOption;
import me.roastlater.domain.model.RecoveryStrategy;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Maps failures to a kind, message keys and a ranked recovery menu. Never
 * performs recovery itself; the caller re-invokes the relevant operation.
 *
 * <p>
 * {@link #report} also logs the failure with its context and keeps the most
 * recent reports in a bounded buffer.
 */
@Service
@Slf4j
public class ErrorRecoveryClassifier {

    private static final String SIZE_LIMIT_KEY = "transfer.error.export_too_large";

    private final Object lock = new Object();
    private final Deque<ErrorReport> recent;
    private final int capacity;

    public ErrorRecoveryClassifier(RoastLaterProperties properties) {
        this.capacity = Math.max(1, properties.getTransfer().getRecentErrorCapacity());
        this.recent = new ArrayDeque<>(capacity);
    }

    public ErrorClassification classify(Throwable error) {
        DataTransferException transferError = unwrap(error);
        if (transferError == null) {
            return ErrorClassification.of(ErrorKind.UNKNOWN, describe(error));
        }
        ErrorKind kind = transferError.getKind();
        if (isSizeLimit(transferError)) {
            return new ErrorClassification(kind, SIZE_LIMIT_KEY, SIZE_LIMIT_KEY + ".suggestion",
                    transferError.getMessageArguments());
        }
        return new ErrorClassification(kind, kind.messageKey(), kind.suggestionKey(),
                transferError.getMessageArguments());
    }

    /**
     * Ranked recovery options. Exactly one is recommended.
     */
    public List<RecoveryOption> recoveryOptions(Throwable error, OperationContext context) {
        ErrorKind kind = classify(error).kind();
        if (isSizeLimit(unwrap(error))) {
            return List.of(RecoveryOption.of(RecoveryStrategy.ABORT, true));
        }
        return switch (kind) {
        case INSUFFICIENT_STORAGE -> List.of(
                RecoveryOption.of(RecoveryStrategy.FREE_STORAGE_AND_RETRY, true),
                RecoveryOption.of(RecoveryStrategy.RETRY, false),
                RecoveryOption.of(RecoveryStrategy.ABORT, false));
        case SERIALIZATION_FAILED, OPERATION_CANCELLED, STORE_ACCESS, OPERATION_IN_PROGRESS -> List.of(
                RecoveryOption.of(RecoveryStrategy.RETRY, true),
                RecoveryOption.of(RecoveryStrategy.ABORT, false));
        case CORRUPTED_DATA -> context != null && context.allowPartialImport()
                ? List.of(
                        RecoveryOption.of(RecoveryStrategy.SKIP_AND_CONTINUE, true),
                        RecoveryOption.of(RecoveryStrategy.ABORT, false))
                : List.of(RecoveryOption.of(RecoveryStrategy.ABORT, true));
        case VERSION_MISMATCH -> List.of(RecoveryOption.of(RecoveryStrategy.ABORT, true));
        case PARTIAL_IMPORT_EXCEEDED -> List.of(
                RecoveryOption.of(RecoveryStrategy.SKIP_AND_CONTINUE, true),
                RecoveryOption.of(RecoveryStrategy.ABORT, false));
        case PREVIEW_NOT_FOUND, UNKNOWN -> List.of(
                RecoveryOption.of(RecoveryStrategy.ABORT, true),
                RecoveryOption.of(RecoveryStrategy.RETRY, false));
        };
    }

    /**
     * Builds the report for a terminal failure, logs it and records it.
     */
    public ErrorReport report(Throwable error, OperationContext context) {
        ErrorClassification classification = classify(error);
        ErrorReport report = new ErrorReport(classification, context, recoveryOptions(error, context));

        if (context != null) {
            log.warn("[Transfer] {} failed during {} ({}/{} items) at {}: {} - {}",
                    context.operation(), context.phase(), context.itemsProcessed(), context.totalItems(),
                    context.timestamp(), classification.kind(), error.getMessage());
        } else {
            log.warn("[Transfer] Operation failed: {} - {}", classification.kind(), error.getMessage());
        }
        if (classification.kind() == ErrorKind.UNKNOWN) {
            log.error("[Transfer] Unexpected failure", error);
        }

        synchronized (lock) {
            if (recent.size() >= capacity) {
                recent.removeFirst();
            }
            recent.addLast(report);
        }
        return report;
    }

    /**
     * Most recent reports first.
     */
    public List<ErrorReport> recentErrors(int limit) {
        List<ErrorReport> result = new ArrayList<>();
        synchronized (lock) {
            Iterator<ErrorReport> iterator = recent.descendingIterator();
            while (iterator.hasNext() && result.size() < limit) {
                result.add(iterator.next());
            }
        }
        return result;
    }

    /**
     * Drops all recorded reports.
     *
     * @return number of reports removed
     */
    public int clearRecentErrors() {
        synchronized (lock) {
            int removed = recent.size();
            recent.clear();
            if (removed > 0) {
                log.info("[Transfer] Cleared {} recorded errors", removed);
            }
            return removed;
        }
    }

    private static boolean isSizeLimit(DataTransferException error) {
        return error instanceof InsufficientStorageException storageError && storageError.isSizeLimit();
    }

    private static DataTransferException unwrap(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            if (current instanceof DataTransferException transferError) {
                return transferError;
            }
            current = current.getCause();
            depth++;
        }
        return null;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
