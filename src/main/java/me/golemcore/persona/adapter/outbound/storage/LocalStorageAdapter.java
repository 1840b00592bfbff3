package me.golemcore.persona.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.infrastructure.config.BotProperties;
import me.golemcore.persona.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Workspace on the local filesystem.
 *
 * <pre>
 * {base-path}/
 *   sessions/      {type}_{id}.json, one per conversation (+ .corrupt quarantine copies)
 *   prompts/       system and character prompt files
 *   preferences/   runtime configuration overrides (+ .bak)
 *   queries/       last payload sent per conversation
 * </pre>
 *
 * <p>
 * Base path comes from {@code bot.storage.local.base-path}; a leading
 * {@code ${user.home}} is expanded. Names may not escape their directory.
 *
 * @see StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final String BACKUP_SUFFIX = ".bak";
    static final String QUARANTINE_SUFFIX = ".corrupt";
    private static final String TEMP_SUFFIX = ".tmp";

    private static final List<String> WORKSPACE_DIRECTORIES = List.of("sessions", "prompts", "preferences",
            "queries");

    private final BotProperties properties;

    private Path root;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        root = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            for (String directory : WORKSPACE_DIRECTORIES) {
                Files.createDirectories(root.resolve(directory));
            }
            log.info("[Storage] Workspace ready at {}", root);
        } catch (IOException e) {
            log.error("[Storage] Cannot prepare workspace at {}", root, e);
        }
    }

    @Override
    public CompletableFuture<String> read(String directory, String name) {
        return io("read", directory, name, file -> Files.isRegularFile(file)
                ? Files.readString(file, StandardCharsets.UTF_8)
                : null);
    }

    @Override
    public CompletableFuture<Void> write(String directory, String name, String content) {
        return io("write", directory, name, file -> {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return null;
        });
    }

    @Override
    public CompletableFuture<Boolean> writeIfAbsent(String directory, String name, String content) {
        return io("create", directory, name, file -> {
            Files.createDirectories(file.getParent());
            try {
                Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW,
                        StandardOpenOption.WRITE);
                return true;
            } catch (FileAlreadyExistsException e) {
                return false;
            }
        });
    }

    @Override
    public CompletableFuture<Void> replace(String directory, String name, String content, boolean keepBackup) {
        return io("replace", directory, name, file -> {
            Files.createDirectories(file.getParent());
            Path staged = sibling(file, TEMP_SUFFIX);
            try {
                writeSynced(staged, content.getBytes(StandardCharsets.UTF_8));
                if (keepBackup && Files.isRegularFile(file)) {
                    Files.copy(file, sibling(file, BACKUP_SUFFIX), StandardCopyOption.REPLACE_EXISTING);
                }
                moveIntoPlace(staged, file);
            } finally {
                Files.deleteIfExists(staged);
            }
            log.debug("[Storage] Replaced {}/{}", directory, name);
            return null;
        });
    }

    @Override
    public CompletableFuture<String> quarantine(String directory, String name) {
        return io("quarantine", directory, name, file -> {
            if (!Files.isRegularFile(file)) {
                return null;
            }
            Path copy = sibling(file, QUARANTINE_SUFFIX);
            Files.copy(file, copy, StandardCopyOption.REPLACE_EXISTING);
            log.warn("[Storage] Quarantined {}/{} as {}", directory, name, copy.getFileName());
            return name + QUARANTINE_SUFFIX;
        });
    }

    @Override
    public CompletableFuture<Void> delete(String directory, String name) {
        return io("delete", directory, name, file -> {
            Files.deleteIfExists(file);
            return null;
        });
    }

    @Override
    public CompletableFuture<List<String>> list(String directory, String suffix) {
        return io("list", directory, "", dir -> {
            if (!Files.isDirectory(dir)) {
                return List.of();
            }
            try (Stream<Path> entries = Files.list(dir)) {
                return entries.filter(Files::isRegularFile)
                        .map(path -> path.getFileName().toString())
                        .filter(fileName -> suffix == null || fileName.endsWith(suffix))
                        .sorted()
                        .toList();
            }
        });
    }

    // ==================== Internals ====================

    @FunctionalInterface
    private interface FileAction<T> {
        T apply(Path file) throws IOException;
    }

    private <T> CompletableFuture<T> io(String operation, String directory, String name, FileAction<T> action) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = locate(directory, name);
            try {
                return action.apply(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Storage " + operation + " failed: " + directory + "/" + name, e);
            }
        });
    }

    private static void writeSynced(Path target, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void moveIntoPlace(Path staged, Path target) throws IOException {
        try {
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Filesystem has no atomic rename, falling back to plain move for {}", target);
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Path sibling(Path file, String suffix) {
        return file.resolveSibling(file.getFileName() + suffix);
    }

    private Path locate(String directory, String name) {
        Path dir = root.resolve(directory).normalize();
        Path resolved = dir.resolve(name).normalize();
        if (!dir.startsWith(root) || !resolved.startsWith(dir)) {
            throw new IllegalArgumentException("Path escapes workspace: " + directory + "/" + name);
        }
        return resolved;
    }
}
