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
import me.bantu.agent.domain.model.ActionPlan;
import me.bantu.agent.domain.model.GenerationOptions;
import me.bantu.agent.infrastructure.config.BantuProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Mediates between the kernel and the registered tools for one user turn.
 *
 * <p>
 * The kernel is asked for a JSON action plan under
 * {@link #INTERPRETER_SYSTEM_PROMPT}. Output without a recognizable plan is
 * returned verbatim; {@code respond} returns {@code args.message}; any other
 * action is dispatched to the tool of that name. Every outcome is a string:
 * dispatch problems become messages, they are not thrown.
 */
@Service
@Slf4j
public class AgentManager {

    public static final String INTERPRETER_SYSTEM_PROMPT = "You are a tool-using agent. Given a user's input, "
            + "decide whether to use a tool and respond in strict JSON ONLY with keys: thought (string), "
            + "action (string), args (object). Use 'respond' as action when a direct answer is sufficient.";

    private final Kernel kernel;
    private final ActionInterpreter interpreter;
    private final ToolCallExecutionService toolExecutionService;
    private final ToolRegistry toolRegistry;
    private final BantuProperties properties;

    public AgentManager(Kernel kernel, ActionInterpreter interpreter, ToolCallExecutionService toolExecutionService,
            ToolRegistry toolRegistry, BantuProperties properties) {
        this.kernel = kernel;
        this.interpreter = interpreter;
        this.toolExecutionService = toolExecutionService;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    public String execute(String userInput) {
        BantuProperties.AgentProperties agent = properties.getAgent();
        GenerationOptions options = GenerationOptions.builder()
                .temperature(agent.getTemperature())
                .maxTokens(agent.getMaxTokens())
                .build();

        String modelText = kernel.processInput(userInput, INTERPRETER_SYSTEM_PROMPT, List.of(), options);

        Optional<ActionPlan> parsed = interpreter.parse(modelText);
        if (parsed.isEmpty()) {
            return modelText;
        }
        ActionPlan plan = parsed.get();
        if (plan.getThought() != null) {
            log.debug("[Agent] Thought: {}", plan.getThought());
        }

        if (plan.isRespond()) {
            return plan.getMessage();
        }

        log.info("[Agent] Dispatching to tool '{}'", plan.getAction());
        return toolExecutionService.execute(plan.getAction(), plan.getArgs()).displayText();
    }

    public void registerTool(ToolComponent tool) {
        toolRegistry.register(tool);
    }

    public boolean unregisterTool(String name) {
        return toolRegistry.unregister(name);
    }

    public List<String> getToolNames() {
        return toolRegistry.names();
    }
}
