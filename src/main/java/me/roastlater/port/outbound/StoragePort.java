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

package me.roastlater.port.outbound;

import java.util.concurrent.CompletableFuture;

/**
 * Port for file storage within the local workspace. Files are organized by
 * directory ("store" for local state, "exports" for snapshot files).
 */
public interface StoragePort {

    /**
     * Read text content from file. Completes with {@code null} when the file
     * does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Atomically write binary content to file with optional backup.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>Verify the written size</li>
     * <li>If backup enabled: copy existing file to .bak</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     * On failure the temporary file is removed and the target is left as it
     * was.
     *
     * @param directory
     *            subdirectory
     * @param path
     *            relative path within directory
     * @param content
     *            content to write
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putObjectAtomic(String directory, String path, byte[] content, boolean backup);

    /**
     * Text variant of {@link #putObjectAtomic}, UTF-8 encoded.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    /**
     * Limit an existing file to owner read/write. Completes with {@code false}
     * when the filesystem has no POSIX permissions.
     */
    CompletableFuture<Boolean> restrictToOwner(String directory, String path);

    /**
     * Bytes available to this process on the volume holding the directory.
     */
    CompletableFuture<Long> usableSpace(String directory);
}
