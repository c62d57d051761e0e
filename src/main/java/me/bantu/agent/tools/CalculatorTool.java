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
import me.bantu.agent.tools.support.ArithmeticEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Evaluates an arithmetic expression such as {@code 2 + 2 * 3}.
 *
 * @see ArithmeticEvaluator
 */
@Component
@Slf4j
public class CalculatorTool implements ToolComponent {

    private static final String PARAM_EXPRESSION = "expression";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("calculator")
                .description("Evaluate an arithmetic expression using + - * / % ** and parentheses.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_EXPRESSION, Map.of(
                                        "type", "string",
                                        "description", "Expression to evaluate, e.g. 2 + 2 * 3")),
                        "required", List.of(PARAM_EXPRESSION)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments args = ToolArguments.bind(getDefinition(), parameters);
        return CompletableFuture.supplyAsync(() -> {
            String expression = args.getString(PARAM_EXPRESSION);
            Number value = ArithmeticEvaluator.evaluate(expression);
            String formatted = ArithmeticEvaluator.format(value);
            log.debug("[Tools] calculator: {} = {}", expression, formatted);
            return ToolResult.success(formatted, value);
        });
    }
}
