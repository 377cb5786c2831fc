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

import me.reasonloop.runtime.domain.model.ActionType;
import me.reasonloop.runtime.domain.model.ExecutionMode;
import me.reasonloop.runtime.domain.model.RiskLevel;
import me.reasonloop.runtime.domain.model.ToolCall;
import me.reasonloop.runtime.domain.model.ToolDefinition;
import me.reasonloop.runtime.domain.model.event.ApprovalRequest;
import me.reasonloop.runtime.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Policy engine deciding which tool calls need a human decision before they
 * run, given the execution mode in force for the step.
 *
 * <p>
 * {@code auto} never asks, {@code manual} asks for every call and
 * {@code supervised} asks only for side-effecting tools. A tool is
 * side-effecting when it is listed in {@code reasonloop.tools.side-effecting},
 * when its definition says so, or when nothing is known about it.
 */
@Component
@Slf4j
public class ToolApprovalPolicy {

    private static final String OPERATION = "operation";
    private static final String UNKNOWN = "unknown";
    private static final String DELETE = "delete";
    private static final int COMMAND_LENGTH_THRESHOLD = 80;
    private static final int PREVIEW_LENGTH_THRESHOLD = 200;

    private final Set<String> sideEffectingTools;

    public ToolApprovalPolicy(AgentProperties properties) {
        this.sideEffectingTools = Set.copyOf(properties.getTools().getSideEffecting());
        log.info("ToolApprovalPolicy side-effecting tools: {}", sideEffectingTools);
    }

    /**
     * Check if a tool call needs approval under the given mode.
     */
    public boolean requiresApproval(ExecutionMode mode, ToolCall toolCall, ToolDefinition definition) {
        return switch (mode) {
        case AUTO -> false;
        case MANUAL -> true;
        case SUPERVISED -> isSideEffecting(toolCall, definition);
        };
    }

    public boolean isSideEffecting(ToolCall toolCall, ToolDefinition definition) {
        if (sideEffectingTools.contains(toolCall.getName())) {
            return true;
        }
        if (definition == null || definition.getSideEffecting() == null) {
            return true;
        }
        return definition.getSideEffecting();
    }

    /**
     * Build the approval request published for a tool call.
     */
    public ApprovalRequest buildRequest(ToolCall toolCall) {
        Map<String, Object> args = toolCall.getArguments();
        ActionType actionType = classifyAction(toolCall);
        return ApprovalRequest.builder()
                .requestId(UUID.randomUUID().toString())
                .actionType(actionType)
                .description(describeAction(toolCall))
                .details(ApprovalRequest.Details.builder()
                        .toolName(toolCall.getName())
                        .command(stringArg(args, "command"))
                        .filePaths(filePaths(args))
                        .riskLevel(assessRisk(toolCall, actionType))
                        .preview(preview(args))
                        .build())
                .build();
    }

    public ActionType classifyAction(ToolCall toolCall) {
        String toolName = toolCall.getName().toLowerCase(Locale.ROOT);
        Map<String, Object> args = toolCall.getArguments();
        return switch (toolName) {
        case "shell" -> ActionType.COMMAND_EXECUTE;
        case "git" -> ActionType.GIT_OPERATION;
        case "http", "browser", "web_fetch" -> ActionType.NETWORK_ACCESS;
        case "filesystem" -> DELETE.equals(stringArg(args, OPERATION)) ? ActionType.FILE_DELETE
                : ActionType.FILE_WRITE;
        default -> ActionType.TOOL_CALL;
        };
    }

    public RiskLevel assessRisk(ToolCall toolCall, ActionType actionType) {
        return switch (actionType) {
        case FILE_DELETE -> RiskLevel.HIGH;
        case COMMAND_EXECUTE -> isDestructiveCommand(stringArg(toolCall.getArguments(), "command"))
                ? RiskLevel.CRITICAL
                : RiskLevel.HIGH;
        case FILE_WRITE, GIT_OPERATION, NETWORK_ACCESS -> RiskLevel.MEDIUM;
        case TOOL_CALL -> RiskLevel.LOW;
        };
    }

    /**
     * Build a human-readable description of the action for the approval prompt.
     */
    public String describeAction(ToolCall toolCall) {
        Map<String, Object> args = toolCall.getArguments();
        return switch (classifyAction(toolCall)) {
        case COMMAND_EXECUTE -> describeShellAction(args);
        case FILE_DELETE -> "Delete file: " + valueOrUnknown(stringArg(args, "path"));
        case FILE_WRITE -> "File operation: " + valueOrUnknown(stringArg(args, OPERATION)) + " on "
                + valueOrUnknown(stringArg(args, "path"));
        default -> toolCall.getName() + ": " + (args != null ? args : Map.of());
        };
    }

    private String describeShellAction(Map<String, Object> args) {
        String command = valueOrUnknown(stringArg(args, "command"));
        if (command.length() > COMMAND_LENGTH_THRESHOLD) {
            command = command.substring(0, COMMAND_LENGTH_THRESHOLD) + "...";
        }
        return "Run command: " + command;
    }

    private static boolean isDestructiveCommand(String command) {
        if (command == null) {
            return false;
        }
        String normalized = command.toLowerCase(Locale.ROOT);
        return normalized.contains("rm -rf") || normalized.contains("mkfs") || normalized.contains("dd if=");
    }

    private static List<String> filePaths(Map<String, Object> args) {
        String path = stringArg(args, "path");
        return path != null ? List.of(path) : List.of();
    }

    private static String preview(Map<String, Object> args) {
        String content = stringArg(args, "content");
        if (content == null) {
            return null;
        }
        return content.length() > PREVIEW_LENGTH_THRESHOLD ? content.substring(0, PREVIEW_LENGTH_THRESHOLD) + "..."
                : content;
    }

    private static String stringArg(Map<String, Object> args, String key) {
        if (args == null) {
            return null;
        }
        Object value = args.get(key);
        return value != null ? value.toString() : null;
    }

    private static String valueOrUnknown(String value) {
        return value != null ? value : UNKNOWN;
    }
}
