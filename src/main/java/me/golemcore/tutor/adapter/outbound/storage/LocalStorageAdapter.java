package me.golemcore.tutor.adapter.outbound.storage;

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
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import me.golemcore.tutor.port.outbound.PersistenceException;
import me.golemcore.tutor.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link StoragePort}.
 *
 * <p>
 * Layout under {@code tutor.storage.local.base-path}:
 * <ul>
 * <li>contexts/ - tutor context per user and subject
 * <li>subjects/ - subject index per user
 * <li>messages/ - chat log per subject (JSONL)
 * <li>content/ - generated content feed per subject (JSONL)
 * <li>sessions/ - assistant session handles per subject
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> DIRECTORIES = List.of("contexts", "subjects", "messages", "content", "sessions");

    private final TutorProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            for (String dir : DIRECTORIES) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Workspace initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create workspace directories at {}", basePath, e);
        }
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> io("write", directory, path, () -> {
            Path file = resolveWithParents(directory, path);
            Files.writeString(file, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return null;
        }));
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> io("read", directory, path, () -> {
            Path file = resolvePath(directory, path);
            return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : null;
        }));
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.exists(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> io("delete", directory, path, () -> {
            Files.deleteIfExists(resolvePath(directory, path));
            return null;
        }));
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> io("list", directory, prefix, () -> {
            Path dir = basePath.resolve(directory);
            Path start = prefix != null && !prefix.isEmpty() ? resolvePath(directory, prefix) : dir;
            if (!Files.exists(start)) {
                return List.<String>of();
            }
            try (Stream<Path> paths = Files.walk(start)) {
                return paths
                        .filter(Files::isRegularFile)
                        .map(p -> dir.relativize(p).toString())
                        .toList();
            }
        }));
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> io("append", directory, path, () -> {
            Path file = resolveWithParents(directory, path);
            Files.writeString(file, content, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return null;
        }));
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolveWithParents(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
                try (OutputStream os = Files.newOutputStream(temp,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.SYNC);
                        FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                    os.write(bytes);
                    os.flush();
                    channel.force(true);
                }
                if (backup && Files.exists(target)) {
                    Files.copy(target, target.resolveSibling(target.getFileName() + ".bak"),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                moveIntoPlace(temp, target);
                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", temp);
                }
                throw new PersistenceException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported, using regular move");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path resolveWithParents(String directory, String path) throws PersistenceException {
        Path file = resolvePath(directory, path);
        Path parent = file.getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new PersistenceException("Failed to create directory for: " + directory + "/" + path, e);
            }
        }
        return file;
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }

    private static <T> T io(String operation, String directory, String path, IoAction<T> action) {
        try {
            return action.run();
        } catch (IOException e) {
            throw new PersistenceException("Failed to " + operation + ": " + directory + "/" + path, e);
        }
    }

    @FunctionalInterface
    private interface IoAction<T> {
        T run() throws IOException;
    }
}
