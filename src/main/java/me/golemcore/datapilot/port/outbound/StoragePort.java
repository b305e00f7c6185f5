package me.golemcore.datapilot.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for durable storage inside the local workspace. Files are organized by
 * top-level directory ({@code projects}, {@code artifacts}) with relative
 * paths below it.
 */
public interface StoragePort {

    /**
     * Write binary content to file, replacing any previous content.
     *
     * @param directory
     *            top-level directory (e.g., "projects", "artifacts")
     * @param path
     *            relative path within directory
     * @param content
     *            binary content
     */
    CompletableFuture<Void> putObject(String directory, String path, byte[] content);

    /**
     * Read binary content from file, or {@code null} if it does not exist.
     */
    CompletableFuture<byte[]> getObject(String directory, String path);

    /**
     * Read text content from file, or {@code null} if it does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Delete a directory below {@code directory} with everything in it.
     */
    CompletableFuture<Void> deleteTree(String directory, String path);

    /**
     * List regular files under a prefix, as paths relative to
     * {@code directory}.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Atomically write binary content.
     *
     * <p>
     * Crash-safe: the content is written to a {@code .tmp} sibling, fsynced,
     * optionally the previous file is kept as {@code .bak}, then the
     * temporary file is renamed over the target.
     */
    CompletableFuture<Void> putObjectAtomic(String directory, String path, byte[] content, boolean backup);

    /**
     * Atomically write UTF-8 text content.
     *
     * @see #putObjectAtomic(String, String, byte[], boolean)
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    /**
     * Ensure directory exists.
     */
    CompletableFuture<Void> ensureDirectory(String directory);

    /**
     * Absolute location of a stored file, for diagnostics and artifact
     * metadata.
     */
    String locate(String directory, String path);
}
