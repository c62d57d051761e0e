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
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Validates a URL and hands it back to the caller. Nothing is fetched; the
 * returned URL is meant to be opened by the user.
 */
@Component
public class OpenUrlTool implements ToolComponent {

    private static final String PARAM_URL = "url";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("open_url")
                .description("Validate a URL so the user can open it.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_URL, Map.of(
                                        "type", "string",
                                        "description", "Absolute URL with scheme and host")),
                        "required", List.of(PARAM_URL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments args = ToolArguments.bind(getDefinition(), parameters);
        String url = args.getString(PARAM_URL);
        if (!isValidUrl(url)) {
            return CompletableFuture.completedFuture(ToolResult.failure("Invalid URL"));
        }
        return CompletableFuture.completedFuture(ToolResult.success(url));
    }

    static boolean isValidUrl(String url) {
        try {
            URI uri = new URI(url);
            String authority = uri.getRawAuthority();
            return uri.getScheme() != null && authority != null && !authority.isEmpty();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
