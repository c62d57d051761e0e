package me.bantu.agent.adapter.outbound.storage;

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

import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
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
 * Stores data under a workspace directory, one subdirectory per data type
 * (currently {@code events/} for the scheduler). Base path configured via
 * {@code bantu.storage.base-path}, defaults to
 * {@code ${user.home}/.bantu/workspace}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String USER_HOME = "${user.home}";

    private final BantuProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        this.basePath = resolveBasePath(properties.getStorage().getBasePath());
        try {
            Files.createDirectories(basePath);
            log.info("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directory {}", basePath, e);
        }
    }

    static Path resolveBasePath(String configured) {
        return Paths.get(configured.replace(USER_HOME, System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path filePath = resolvePath(directory, path);
            if (!Files.exists(filePath)) {
                return null;
            }
            try {
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(directory, path);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
            try {
                createParent(targetPath);
                Files.writeString(tempPath, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC);

                if (backup && Files.exists(targetPath)) {
                    Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");
                    Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                }

                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            } catch (IOException e) {
                deleteQuietly(tempPath);
                throw new UncheckedIOException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException cleanupEx) {
            log.warn("[Storage] Failed to cleanup temp file: {}", path);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
