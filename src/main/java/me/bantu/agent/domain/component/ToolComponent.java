package me.bantu.agent.domain.component;

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

import me.bantu.agent.domain.model.ToolDefinition;
import me.bantu.agent.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing an executable tool the agent can invoke by name.
 * Tools expose a JSON Schema definition that is used both to describe them and
 * to bind the arguments chosen by the language model.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with the JSON Schema of its parameters.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified parameters. Implementations report
     * argument problems by throwing {@link ToolArgumentException} (directly or as
     * the cause of the returned future) and other problems as a failed
     * {@link ToolResult} or an exceptionally completed future.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
