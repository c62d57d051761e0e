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
import me.bantu.agent.infrastructure.config.BantuProperties;
import me.bantu.agent.tools.support.WorkspacePathResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the start of a workspace text file. At most {@code max_bytes} bytes
 * are read; invalid UTF-8 (including a multi-byte sequence cut by the limit)
 * is replaced rather than rejected.
 */
@Component
@Slf4j
public class ReadTextTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final String PARAM_MAX_BYTES = "max_bytes";

    private final WorkspacePathResolver pathResolver;
    private final int defaultMaxBytes;

    public ReadTextTool(WorkspacePathResolver pathResolver, BantuProperties properties) {
        this.pathResolver = pathResolver;
        this.defaultMaxBytes = properties.getTools().getReadMaxBytes();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("read_text")
                .description("Read a text file from the workspace, up to max_bytes bytes.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "File path relative to the workspace"),
                                PARAM_MAX_BYTES, Map.of(
                                        "type", "integer",
                                        "description", "Maximum number of bytes to read (default: "
                                                + defaultMaxBytes + ")")),
                        "required", List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments args = ToolArguments.bind(getDefinition(), parameters);
        return CompletableFuture.supplyAsync(() -> {
            String pathStr = args.getString(PARAM_PATH);
            int maxBytes = args.getInt(PARAM_MAX_BYTES, defaultMaxBytes);
            if (maxBytes < 0) {
                throw new IllegalArgumentException("max_bytes must not be negative");
            }
            Path file = pathResolver.resolve(pathStr);
            if (!Files.isRegularFile(file)) {
                throw new IllegalArgumentException("Not a file: " + pathStr);
            }
            try (InputStream in = Files.newInputStream(file)) {
                byte[] data = in.readNBytes(maxBytes);
                return ToolResult.success(decodeLenient(data));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read file: " + pathStr, e);
            }
        });
    }

    static String decodeLenient(byte[] data) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(data)).toString();
        } catch (CharacterCodingException e) {
            // unreachable with REPLACE actions
            throw new IllegalStateException(e);
        }
    }
}
