package me.bantu.agent.domain.service;

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

import me.bantu.agent.domain.component.ToolComponent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-to-tool registry shared by the kernel and the dispatcher. Enabled
 * {@link ToolComponent} beans are registered at construction; later
 * registrations under an existing name replace the previous tool.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<ToolComponent> components) {
        if (components == null) {
            return;
        }
        for (ToolComponent tool : components) {
            if (tool.isEnabled()) {
                register(tool);
            } else {
                log.debug("[Tools] Skipping disabled tool: {}", tool.getToolName());
            }
        }
    }

    public void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        ToolComponent previous = tools.put(name, tool);
        if (previous != null && previous != tool) {
            log.info("[Tools] Replaced tool: {}", name);
        } else {
            log.debug("[Tools] Registered tool: {}", name);
        }
    }

    /**
     * Removes a tool, returning whether one was registered under that name.
     */
    public boolean unregister(String name) {
        boolean removed = name != null && tools.remove(name) != null;
        if (removed) {
            log.debug("[Tools] Unregistered tool: {}", name);
        }
        return removed;
    }

    public ToolComponent get(String name) {
        return name != null ? tools.get(name) : null;
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /**
     * Returns the registered tool names in alphabetical order.
     */
    public List<String> names() {
        return tools.keySet().stream().sorted().toList();
    }

    public Collection<ToolComponent> all() {
        return List.copyOf(tools.values());
    }
}
