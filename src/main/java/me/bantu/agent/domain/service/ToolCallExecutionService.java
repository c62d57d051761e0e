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

import me.bantu.agent.domain.component.ToolArgumentException;
import me.bantu.agent.domain.component.ToolArguments;
import me.bantu.agent.domain.component.ToolComponent;
import me.bantu.agent.domain.model.ToolFailureKind;
import me.bantu.agent.domain.model.ToolResult;
import me.bantu.agent.infrastructure.config.BantuProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes a named tool call and turns every outcome into display text.
 *
 * <p>
 * Arguments are bound against the tool's schema before the tool runs. Failures
 * never escape: an unknown name, an argument mismatch and a runtime failure
 * each map to a fixed message shape (see {@link #toDisplayText}).
 */
@Service
@Slf4j
public class ToolCallExecutionService {

    private final ToolRegistry toolRegistry;
    private final Duration timeout;

    public ToolCallExecutionService(ToolRegistry toolRegistry, BantuProperties properties) {
        this.toolRegistry = toolRegistry;
        this.timeout = properties.getTools().getTimeout();
    }

    public ToolCallExecutionResult execute(String toolName, Map<String, Object> arguments) {
        ToolResult result = executeToolCall(toolName, arguments);
        return new ToolCallExecutionResult(toolName, result, toDisplayText(toolName, result));
    }

    private ToolResult executeToolCall(String toolName, Map<String, Object> arguments) {
        ToolComponent tool = toolRegistry.get(toolName);
        if (tool == null) {
            return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + toolName);
        }

        try {
            ToolArguments.bind(tool.getDefinition(), arguments);
            CompletableFuture<ToolResult> future = tool.execute(arguments != null ? arguments : Map.of());
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ToolResult.success("");
        } catch (ToolArgumentException e) {
            log.debug("[Tools] Argument error for '{}': {}", toolName, e.getMessage());
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ToolArgumentException) {
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, cause.getMessage());
            }
            log.warn("[Tools] Tool '{}' failed", toolName, cause);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, safeCauseMessage(cause));
        } catch (TimeoutException e) {
            log.warn("[Tools] Tool '{}' timed out after {}", toolName, timeout);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "timed out after " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "interrupted");
        } catch (RuntimeException e) {
            log.warn("[Tools] Tool '{}' failed", toolName, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, safeCauseMessage(e));
        }
    }

    /**
     * Maps a tool result to the text returned to the user:
     * <ul>
     * <li>success: the tool output</li>
     * <li>unknown tool: {@code Unknown tool: <name>}</li>
     * <li>argument mismatch: {@code Tool '<name>' argument error: <details>}</li>
     * <li>anything else: {@code Tool '<name>' failed: <details>}</li>
     * </ul>
     */
    static String toDisplayText(String toolName, ToolResult result) {
        if (result.isSuccess()) {
            return result.getOutput() != null ? result.getOutput() : "";
        }
        ToolFailureKind kind = result.getFailureKind() != null ? result.getFailureKind()
                : ToolFailureKind.EXECUTION_FAILED;
        return switch (kind) {
        case UNKNOWN_TOOL -> "Unknown tool: " + toolName;
        case INVALID_ARGUMENTS -> "Tool '" + toolName + "' argument error: " + result.getError();
        case EXECUTION_FAILED -> "Tool '" + toolName + "' failed: " + result.getError();
        };
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
