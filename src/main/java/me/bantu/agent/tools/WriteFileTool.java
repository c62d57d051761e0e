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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes UTF-8 text to a workspace file. Existing files are only replaced when
 * {@code allow_overwrite} is set; missing parent directories are created unless
 * {@code create_parents} is false. Returns the written path.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WriteFileTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_ALLOW_OVERWRITE = "allow_overwrite";
    private static final String PARAM_CREATE_PARENTS = "create_parents";
    private static final String TYPE = "type";
    private static final String BOOLEAN = "boolean";
    private static final String DESCRIPTION = "description";

    private final WorkspacePathResolver pathResolver;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("write_file")
                .description("Write text content to a file in the workspace.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "File path relative to the workspace"),
                                PARAM_CONTENT, Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "Text to write"),
                                PARAM_ALLOW_OVERWRITE, Map.of(
                                        TYPE, BOOLEAN,
                                        DESCRIPTION, "Replace the file if it exists (default: false)"),
                                PARAM_CREATE_PARENTS, Map.of(
                                        TYPE, BOOLEAN,
                                        DESCRIPTION, "Create missing parent directories (default: true)")),
                        "required", List.of(PARAM_PATH, PARAM_CONTENT)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments args = ToolArguments.bind(getDefinition(), parameters);
        return CompletableFuture.supplyAsync(() -> {
            String pathStr = args.getString(PARAM_PATH);
            String content = args.getString(PARAM_CONTENT);
            boolean allowOverwrite = args.getBoolean(PARAM_ALLOW_OVERWRITE, false);
            boolean createParents = args.getBoolean(PARAM_CREATE_PARENTS, true);

            Path target = pathResolver.resolve(pathStr);
            if (Files.isDirectory(target)) {
                throw new IllegalArgumentException("Target is a directory: " + pathStr);
            }
            if (Files.exists(target) && !allowOverwrite) {
                throw new IllegalStateException("Refusing to overwrite existing file: " + pathStr);
            }
            try {
                Path parent = target.getParent();
                if (createParents && parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(target, content, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write file: " + pathStr, e);
            }
            String written = pathResolver.relativize(target);
            log.info("[Tools] Wrote {} chars to {}", content.length(), written);
            return ToolResult.success(written, Map.of("path", written, "size", content.length()));
        });
    }
}
