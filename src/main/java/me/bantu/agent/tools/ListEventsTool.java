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
import me.bantu.agent.domain.service.SchedulingService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Lists scheduled events in time order, one {@code id\twhen\ttitle} line per
 * event.
 */
@Component
@RequiredArgsConstructor
public class ListEventsTool implements ToolComponent {

    private final SchedulingService schedulingService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.simple("list_events", "List all scheduled events in time order.");
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments.bind(getDefinition(), parameters);
        return CompletableFuture.supplyAsync(() -> {
            List<TimedEvent> events = schedulingService.listEvents();
            if (events.isEmpty()) {
                return ToolResult.success("No events.", events);
            }
            String listing = events.stream()
                    .map(TimedEvent::toListingLine)
                    .collect(Collectors.joining("\n"));
            return ToolResult.success(listing, events);
        });
    }
}
