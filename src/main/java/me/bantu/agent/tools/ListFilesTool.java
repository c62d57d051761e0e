package me.bantu.agent.tools;

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

import me.bantu.agent.domain.component.ToolArguments;
import me.bantu.agent.domain.component.ToolComponent;
import me.bantu.agent.domain.model.ToolDefinition;
import me.bantu.agent.domain.model.ToolResult;
import me.bantu.agent.tools.support.WorkspacePathResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Lists regular files (not directories) under a workspace directory, as sorted
 * workspace-relative paths. With {@code recursive} the whole subtree is walked.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ListFilesTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final String PARAM_RECURSIVE = "recursive";

    private final WorkspacePathResolver pathResolver;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("list_files")
                .description("List the files in a workspace directory, optionally recursively.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "Directory path relative to the workspace"),
                                PARAM_RECURSIVE, Map.of(
                                        "type", "boolean",
                                        "description", "Include files in subdirectories (default: false)")),
                        "required", List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments args = ToolArguments.bind(getDefinition(), parameters);
        return CompletableFuture.supplyAsync(() -> {
            String pathStr = args.getString(PARAM_PATH);
            boolean recursive = args.getBoolean(PARAM_RECURSIVE, false);
            Path dir = pathResolver.resolve(pathStr);
            if (!Files.isDirectory(dir)) {
                throw new IllegalArgumentException("Not a directory: " + pathStr);
            }
            try (Stream<Path> entries = recursive ? Files.walk(dir) : Files.list(dir)) {
                List<String> files = entries
                        .filter(Files::isRegularFile)
                        .map(pathResolver::relativize)
                        .sorted()
                        .toList();
                log.debug("[Tools] list_files {} (recursive={}): {} files", pathStr, recursive, files.size());
                return ToolResult.success(String.join("\n", files), files);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list files: " + pathStr, e);
            }
        });
    }
}
