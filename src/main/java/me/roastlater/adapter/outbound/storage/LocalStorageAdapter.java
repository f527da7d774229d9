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

package me.roastlater.adapter.outbound.storage;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import me.roastlater.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores all data in a local workspace directory with subdirectories:
 * <ul>
 * <li>store/ - content records, favorites and preferences
 * <li>exports/ - exported snapshot files
 * </ul>
 *
 * <p>
 * Base path configured via {@code roastlater.storage.local.base-path}, defaults
 * to {@code ${user.home}/.roastlater/workspace}.
 *
 * @see me.roastlater.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final RoastLaterProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            for (String dir : List.of(properties.getStorage().getStoreDirectory(),
                    properties.getTransfer().getExportDirectory())) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolvePath(directory, path));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> restrictToOwner(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path filePath = resolvePath(directory, path);
            try {
                if (!Files.getFileStore(filePath).supportsFileAttributeView(PosixFileAttributeView.class)) {
                    return false;
                }
                Files.setPosixFilePermissions(filePath, OWNER_ONLY);
                log.debug("[Storage] Restricted {}/{} to owner", directory, path);
                return true;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to restrict permissions: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Long> usableSpace(String directory) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path dirPath = resolveDirectory(directory);
                Path target = Files.exists(dirPath) ? dirPath : basePath;
                return Files.getFileStore(target).getUsableSpace();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to query usable space: " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return putObjectAtomic(directory, path, content.getBytes(StandardCharsets.UTF_8), backup);
    }

    @Override
    public CompletableFuture<Void> putObjectAtomic(String directory, String path, byte[] content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(directory, path);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
            Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");

            try {
                Path parent = targetPath.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }

                // 1. Write to temp file with fsync
                try (OutputStream os = Files.newOutputStream(tempPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.SYNC);
                        FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                    os.write(content);
                    os.flush();
                    channel.force(true);
                }

                // 2. Verify size
                long written = Files.size(tempPath);
                if (written != content.length) {
                    throw new IOException("Verification failed: size mismatch");
                }

                // 3. Backup existing file if requested
                if (backup && Files.exists(targetPath)) {
                    Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("[Storage] Created backup: {}", backupPath);
                }

                // 4. Atomic rename
                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }

                log.debug("[Storage] Atomic write completed: {}/{} ({} bytes)", directory, path, content.length);

            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
                }
                throw new UncheckedIOException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private Path resolveDirectory(String directory) {
        Path resolved = basePath.resolve(directory).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory);
        }
        return resolved;
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
