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
import me.bantu.agent.domain.model.TimedEvent;
import me.bantu.agent.domain.model.ToolDefinition;
import me.bantu.agent.domain.model.ToolResult;
import me.bantu.agent.domain.service.RetrievalMemory;
import me.bantu.agent.domain.service.SchedulingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Schedules an event from a natural-language time ("tomorrow at 8am", "in 2
 * hours"). When memory has an embedder, a note about the event is stored in
 * the background; failures there never affect the tool result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AddEventTool implements ToolComponent {

    private static final String PARAM_TITLE = "title";
    private static final String PARAM_WHEN = "when";

    private final SchedulingService schedulingService;
    private final RetrievalMemory memory;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("add_event")
                .description("Schedule an event. 'when' accepts times like 'tomorrow at 8am', "
                        + "'in 30 minutes', '14:30' or '2025-01-02 08:00'.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_TITLE, Map.of(
                                        "type", "string",
                                        "description", "Event title"),
                                PARAM_WHEN, Map.of(
                                        "type", "string",
                                        "description", "When the event happens")),
                        "required", List.of(PARAM_TITLE, PARAM_WHEN)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments args = ToolArguments.bind(getDefinition(), parameters);
        return CompletableFuture.supplyAsync(() -> {
            String title = args.getString(PARAM_TITLE);
            String when = args.getString(PARAM_WHEN);
            TimedEvent event = schedulingService.addEvent(title, when);
            rememberEvent(event.getId(), title, when);
            return ToolResult.success("event_id=" + event.getId(), event);
        });
    }

    private void rememberEvent(long id, String title, String when) {
        if (!memory.isConfigured()) {
            return;
        }
        String note = "Event: " + title + " at " + when + " (id=" + id + ")";
        CompletableFuture.runAsync(() -> memory.storeText(note, Map.of("source", "scheduler", "event_id", id)))
                .exceptionally(e -> {
                    log.warn("[Scheduler] Failed to store memory note for event {}: {}", id, e.getMessage());
                    return null;
                });
    }
}
