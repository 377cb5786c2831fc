package me.reasonloop.runtime.tools;

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
import me.reasonloop.runtime.domain.exception.ValidationException;
import me.reasonloop.runtime.domain.history.ChatHistoryManager;
import me.reasonloop.runtime.domain.model.ToolDefinition;
import me.reasonloop.runtime.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Built-in tool letting the model drop messages from its own context.
 *
 * <p>
 * Parameters: {@code messageIds} (array of history message ids, required) and
 * {@code reason} (optional). Excluded messages never come back.
 */
@Slf4j
public class ExcludeChatHistoryTool implements ToolComponent {

    public static final String NAME = "excludeChatHistory";

    private static final String MESSAGE_IDS = "messageIds";
    private static final String REASON = "reason";

    private final ChatHistoryManager chatHistoryManager;

    public ExcludeChatHistoryTool(ChatHistoryManager chatHistoryManager) {
        this.chatHistoryManager = chatHistoryManager;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Exclude chat history messages that are no longer relevant from the prompt. "
                        + "Use the message ids shown in the chat history blocks.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                MESSAGE_IDS, Map.of(
                                        "type", "array",
                                        "items", Map.of("type", "string"),
                                        "description", "Ids of the messages to exclude"),
                                REASON, Map.of(
                                        "type", "string",
                                        "description", "Why the messages are excluded")),
                        "required", List.of(MESSAGE_IDS)))
                .sideEffecting(false)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        List<String> messageIds = messageIds(parameters.get(MESSAGE_IDS));
        if (messageIds.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.failure("messageIds must be a non-empty array"));
        }
        try {
            chatHistoryManager.excludeChatHistoryBatch(messageIds);
        } catch (ValidationException e) {
            return CompletableFuture.completedFuture(ToolResult.failure(e.getMessage()));
        }
        Object reason = parameters.get(REASON);
        log.debug("[Tools] Excluded {} messages, reason: {}", messageIds.size(), reason);
        return CompletableFuture.completedFuture(ToolResult.success(
                "Excluded " + messageIds.size() + " messages" + (reason != null ? " (" + reason + ")" : ""),
                Map.of("excludedCount", messageIds.size(), "messageIds", messageIds)));
    }

    private static List<String> messageIds(Object raw) {
        List<String> ids = new ArrayList<>();
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null) {
                    ids.add(value.toString());
                }
            }
        } else if (raw instanceof String single && !single.isBlank()) {
            ids.add(single);
        }
        return ids;
    }
}
