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
 * Outcome of a completed export.
 *
 * @param snapshot
 *            exported snapshot
 * @param fileName
 *            file name inside the export directory
 * @param sizeBytes
 *            size of the written file
 * @param checksum
 *            SHA-256 hex checksum embedded in the file
 */
public record ExportResult(Snapshot snapshot, String fileName, long sizeBytes, String checksum) {
}
