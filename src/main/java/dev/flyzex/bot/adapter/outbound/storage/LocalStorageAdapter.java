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

package dev.flyzex.bot.adapter.outbound.storage;

import dev.flyzex.bot.port.outbound.StoragePersistenceException;
import dev.flyzex.bot.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Relative paths resolve against the working directory; a leading
 * {@code ${user.home}} placeholder is expanded. Temporary and backup files live
 * next to the target ({@code <name>.tmp}, {@code <name>.bak}) so the final
 * rename never crosses a filesystem boundary.
 *
 * @see dev.flyzex.bot.port.outbound.StoragePort
 */
@Component
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    @Override
    public CompletableFuture<byte[]> getObject(String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path filePath = resolvePath(path);
            try {
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readAllBytes(filePath);
            } catch (IOException e) {
                throw new StoragePersistenceException("Failed to read file: " + filePath, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> ensureParentDirectory(String path) {
        return CompletableFuture.runAsync(() -> {
            Path parent = resolvePath(path).getParent();
            if (parent == null) {
                return;
            }
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new StoragePersistenceException("Failed to create directory: " + parent, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putObjectAtomic(String path, byte[] content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(path);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
            Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");

            try {
                Path parent = targetPath.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }

                // 1. Write to temp file with fsync
                writeTempFile(tempPath, content);

                // 2. Verify written content is readable
                long written = Files.size(tempPath);
                if (written != content.length) {
                    throw new IOException("Verification failed: size mismatch (" + written + " != "
                            + content.length + ")");
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

                log.debug("[Storage] Atomic write completed: {} ({} bytes)", targetPath, content.length);

            } catch (IOException | RuntimeException e) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", tempPath, cleanupEx);
                }
                throw new StoragePersistenceException("Atomic write failed: " + targetPath, e);
            }
        });
    }

    /**
     * Writes and fsyncs the temporary file.
     */
    protected void writeTempFile(Path tempPath, byte[] content) throws IOException {
        try (OutputStream os = Files.newOutputStream(tempPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
                FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
            os.write(content);
            os.flush();
            channel.force(true); // fsync: metadata + data
        }
    }

    private Path resolvePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Storage path must not be empty");
        }
        String expanded = path.replace("${user.home}", System.getProperty("user.home"));
        return Paths.get(expanded).toAbsolutePath().normalize();
    }
}
