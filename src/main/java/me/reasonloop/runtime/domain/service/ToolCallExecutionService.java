package me.reasonloop.runtime.domain.service;

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

import me.reasonloop.runtime.domain.component.ToolComponent;
import me.reasonloop.runtime.domain.model.ToolCall;
import me.reasonloop.runtime.domain.model.ToolExecutionResult;
import me.reasonloop.runtime.domain.model.ToolResult;
import me.reasonloop.runtime.infrastructure.config.AgentProperties;
import me.reasonloop.runtime.port.outbound.ToolPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pure tool-call execution service: resolves a call to a built-in tool or the
 * external tool port, runs it with a timeout and maps every outcome to a
 * {@link ToolExecutionResult}.
 *
 * <p>
 * Does NOT ask for approval and does NOT touch chat history. Tool failures,
 * timeouts and unknown tools become failed results, never exceptions.
 */
@Component
@Slf4j
public class ToolCallExecutionService {

    private final Duration toolTimeout;

    public ToolCallExecutionService(AgentProperties properties) {
        this.toolTimeout = properties.getAgent().getToolTimeout();
    }

    public ToolExecutionResult execute(ToolCall toolCall, Map<String, ToolComponent> builtinTools,
            ToolPort toolPort) {
        long startedAt = System.nanoTime();
        String toolName = sanitizeToolName(toolCall.getName());
        if (toolName == null || toolName.isBlank()) {
            return ToolExecutionResult.failed(toolCall, "Tool call has no name", elapsedMillis(startedAt));
        }

        ToolComponent builtin = builtinTools.get(toolName);
        CompletableFuture<ToolResult> future;
        try {
            if (builtin != null) {
                if (!builtin.isEnabled()) {
                    return ToolExecutionResult.failed(toolCall, "Tool is disabled: " + toolName,
                            elapsedMillis(startedAt));
                }
                future = builtin.execute(toolCall.getArguments() != null ? toolCall.getArguments() : Map.of());
            } else if (toolPort != null) {
                future = toolPort.execute(toolCall.toBuilder().name(toolName).build());
            } else {
                String available = String.join(", ", builtinTools.keySet());
                return ToolExecutionResult.failed(toolCall,
                        "Unknown tool: " + toolName + ". Available tools: " + available, elapsedMillis(startedAt));
            }
        } catch (RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            return ToolExecutionResult.failed(toolCall, "Tool execution failed: " + safeCauseMessage(e),
                    elapsedMillis(startedAt));
        }
        return await(toolCall, future, startedAt);
    }

    private ToolExecutionResult await(ToolCall toolCall, CompletableFuture<ToolResult> future, long startedAt) {
        if (future == null) {
            return ToolExecutionResult.failed(toolCall, "Tool returned no result", elapsedMillis(startedAt));
        }
        try {
            ToolResult result = future.get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolExecutionResult.failed(toolCall, "Tool returned no result", elapsedMillis(startedAt));
            }
            log.debug("[Tools] {} finished, success: {}", toolCall.getName(), result.isSuccess());
            return ToolExecutionResult.from(toolCall, result, elapsedMillis(startedAt));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] {} timed out after {}", toolCall.getName(), toolTimeout);
            return ToolExecutionResult.failed(toolCall, "Tool execution timed out after " + toolTimeout,
                    elapsedMillis(startedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolExecutionResult.failed(toolCall, "Tool execution interrupted", elapsedMillis(startedAt));
        } catch (ExecutionException e) {
            log.error("[Tools] Tool execution failed: {}", toolCall.getName(), e.getCause());
            return ToolExecutionResult.failed(toolCall, "Tool execution failed: " + safeCauseMessage(e),
                    elapsedMillis(startedAt));
        }
    }

    private static long elapsedMillis(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
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

    /**
     * Strip special tokens some models leak into tool call names, e.g.
     * {@code <|channel|>}.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
