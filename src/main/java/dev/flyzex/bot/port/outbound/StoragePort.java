package dev.flyzex.bot.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the byte-level persistence of the state snapshot. Paths are
 * resolved by the implementation; the store only deals with opaque encrypted
 * bytes.
 */
public interface StoragePort {

    /**
     * Read binary content from file.
     *
     * @return file content, or {@code null} if the file does not exist
     */
    CompletableFuture<byte[]> getObject(String path);

    /**
     * Ensure the parent directory of the path exists.
     */
    CompletableFuture<Void> ensureParentDirectory(String path);

    /**
     * Atomically replace the file content with optional backup.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>If backup enabled: copy existing file to .bak</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     * If any step fails the temporary file is removed and the target file is
     * left untouched.
     *
     * @param path
     *            target file
     * @param content
     *            bytes to write
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putObjectAtomic(String path, byte[] content, boolean backup);
}
