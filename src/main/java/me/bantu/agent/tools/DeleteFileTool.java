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

/**
 * Deletes a single workspace file. The caller must pass {@code confirm=true};
 * directories are never deleted. Output is {@code true} when a file was
 * removed and {@code false} when nothing existed at the path.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeleteFileTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final String PARAM_CONFIRM = "confirm";

    private final WorkspacePathResolver pathResolver;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("delete_file")
                .description("Delete a file from the workspace. Requires confirm=true.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "File path relative to the workspace"),
                                PARAM_CONFIRM, Map.of(
                                        "type", "boolean",
                                        "description", "Must be true to actually delete")),
                        "required", List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments args = ToolArguments.bind(getDefinition(), parameters);
        return CompletableFuture.supplyAsync(() -> {
            if (!args.getBoolean(PARAM_CONFIRM, false)) {
                throw new IllegalStateException("Deletion requires confirm=true to proceed");
            }
            String pathStr = args.getString(PARAM_PATH);
            Path target = pathResolver.resolve(pathStr);
            if (!Files.exists(target)) {
                return ToolResult.success("false", false);
            }
            if (Files.isDirectory(target)) {
                throw new IllegalArgumentException("Refusing to delete a directory with this helper");
            }
            try {
                Files.delete(target);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete file: " + pathStr, e);
            }
            log.info("[Tools] Deleted {}", pathStr);
            return ToolResult.success("true", true);
        });
    }
}
