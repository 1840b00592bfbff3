package me.golemcore.persona.port.outbound;

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
 * Durable record store for the responder workspace. Records are text files
 * addressed by a directory ({@code sessions}, {@code prompts},
 * {@code preferences}, {@code queries}) and a name relative to it.
 *
 * <p>
 * All operations complete exceptionally with
 * {@link java.io.UncheckedIOException} on I/O failure.
 */
public interface StoragePort {

    /**
     * Reads a record. Completes with {@code null} when it does not exist.
     */
    CompletableFuture<String> read(String directory, String name);

    /**
     * Overwrites a record in place. For data that may be lost on a crash, such
     * as the last-query dump.
     */
    CompletableFuture<Void> write(String directory, String name, String content);

    /**
     * Creates a record only if none exists yet.
     *
     * @return {@code true} if the record was created
     */
    CompletableFuture<Boolean> writeIfAbsent(String directory, String name, String content);

    /**
     * Replaces a record so that readers and a restart observe either the old or
     * the new content, never a partial write. The content is flushed to disk
     * before it becomes visible.
     *
     * @param keepBackup
     *            keep the previous content as {@code <name>.bak}
     */
    CompletableFuture<Void> replace(String directory, String name, String content, boolean keepBackup);

    /**
     * Copies an unreadable record to {@code <name>.corrupt} so it survives
     * being replaced. Completes with the quarantine name, or {@code null} if
     * the record does not exist.
     */
    CompletableFuture<String> quarantine(String directory, String name);

    /**
     * Deletes a record. Missing records are ignored.
     */
    CompletableFuture<Void> delete(String directory, String name);

    /**
     * Names of the records directly inside {@code directory} that end with
     * {@code suffix}, sorted.
     */
    CompletableFuture<List<String>> list(String directory, String suffix);
}
