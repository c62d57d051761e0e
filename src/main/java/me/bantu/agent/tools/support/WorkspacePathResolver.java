package me.bantu.agent.tools.support;

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves tool-supplied paths inside the sandbox workspace
 * ({@code bantu.tools.workspace}). Relative paths are resolved against the
 * workspace root; absolute paths are accepted only if they already lie inside
 * it. Existing paths are also checked after following symlinks.
 */
@Component
@Slf4j
public class WorkspacePathResolver {

    private final Path workspaceRoot;

    @Autowired
    public WorkspacePathResolver(BantuProperties properties) {
        this(Paths.get(properties.getTools().getWorkspace()
                .replace("${user.home}", System.getProperty("user.home"))));
    }

    public WorkspacePathResolver(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.workspaceRoot);
            log.info("[Tools] Workspace: {}", this.workspaceRoot);
        } catch (IOException e) {
            log.error("[Tools] Failed to create workspace directory: {}", this.workspaceRoot, e);
        }
    }

    /**
     * @throws IllegalArgumentException
     *             if the path is malformed or escapes the workspace
     */
    public Path resolve(String pathStr) {
        Path resolved;
        try {
            resolved = workspaceRoot.resolve(pathStr).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path: " + pathStr, e);
        }
        if (!resolved.startsWith(workspaceRoot)) {
            log.warn("[Tools] Path outside workspace blocked: {}", pathStr);
            throw new IllegalArgumentException("Path is outside the workspace: " + pathStr);
        }

        if (Files.exists(resolved)) {
            try {
                Path realPath = resolved.toRealPath();
                if (!realPath.startsWith(workspaceRoot.toRealPath())) {
                    log.warn("[Tools] Symlink escape blocked: {} -> {}", resolved, realPath);
                    throw new IllegalArgumentException("Path is outside the workspace: " + pathStr);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to resolve path: " + pathStr, e);
            }
        }
        return resolved;
    }

    /**
     * Returns the path relative to the workspace root, using {@code /}
     * separators; the root itself is {@code "."}.
     */
    public String relativize(Path path) {
        String relative = workspaceRoot.relativize(path).toString().replace('\\', '/');
        return relative.isEmpty() ? "." : relative;
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }
}
