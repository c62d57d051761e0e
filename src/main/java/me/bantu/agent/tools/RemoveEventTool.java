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
import me.bantu.agent.domain.service.SchedulingService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Removes a scheduled event by id. Output is {@code removed} or
 * {@code not_found}.
 */
@Component
@RequiredArgsConstructor
public class RemoveEventTool implements ToolComponent {

    private static final String PARAM_EVENT_ID = "event_id";

    private final SchedulingService schedulingService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("remove_event")
                .description("Remove a scheduled event by its id.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_EVENT_ID, Map.of(
                                        "type", "integer",
                                        "description", "Id returned by add_event")),
                        "required", List.of(PARAM_EVENT_ID)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments args = ToolArguments.bind(getDefinition(), parameters);
        return CompletableFuture.supplyAsync(() -> {
            boolean removed = schedulingService.removeEvent(args.getLong(PARAM_EVENT_ID, -1));
            return ToolResult.success(removed ? "removed" : "not_found", removed);
        });
    }
}
