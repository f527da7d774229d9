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

package me.roastlater.port.inbound;

import me.roastlater.domain.model.ComplianceReport;
import me.roastlater.domain.model.ErrorReport;
import me.roastlater.domain.model.ExportOptions;
import me.roastlater.domain.model.ExportResult;
import me.roastlater.domain.model.ImportOptions;
import me.roastlater.domain.model.ImportPreview;
import me.roastlater.domain.model.ImportResult;
import me.roastlater.domain.model.ImportWarning;
import me.roastlater.domain.model.OperationProgress;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Inbound port for exporting and importing local state.
 *
 * <p>
 * At most one export or import touches the store at a time; further requests
 * wait for the running one. Progress streams end with a COMPLETED element
 * carrying the result, or a FAILED element carrying the error report followed
 * by an error signal.
 */
public interface DataTransferPort {

    /**
     * Privacy notice and issues for the given export options. Pure.
     */
    ComplianceReport analyze(ExportOptions options);

    Flux<OperationProgress<ExportResult>> startExport(ExportOptions options);

    /**
     * Parses the payload and builds a preview. The preview stays pending until
     * it is confirmed or discarded; a newer preview replaces it.
     */
    Mono<ImportPreview> startImport(byte[] payload);

    /**
     * Applies the pending preview. The preview is consumed when the apply
     * completes; after a failure or cancellation it stays pending and can be
     * confirmed again with other options.
     *
     * @throws me.roastlater.domain.exception.PreviewNotFoundException
     *             signalled on the stream when no preview with that id is pending
     */
    Flux<OperationProgress<ImportResult>> confirmImport(String previewId, ImportOptions options);

    /**
     * Drops the pending preview.
     *
     * @return true if a preview was discarded
     */
    boolean discardPreview(String previewId);

    /**
     * Requests cancellation of the running operation.
     *
     * @return true if a running operation was flagged
     */
    boolean cancelCurrentOperation();

    Mono<Long> estimateExportSize();

    Mono<List<ImportWarning>> validateLocalData();

    List<ErrorReport> recentErrors(int limit);

    /**
     * @return number of recorded errors removed
     */
    int clearRecentErrors();
}
