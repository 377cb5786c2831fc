package me.reasonloop.runtime.domain.history;

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

import me.reasonloop.runtime.domain.exception.ValidationException;
import me.reasonloop.runtime.domain.model.ChatHistoryConfig;
import me.reasonloop.runtime.domain.model.ChatMessage;
import me.reasonloop.runtime.domain.model.MessageType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Per-agent chat history with per-type retention windows and explicit
 * exclusion.
 *
 * <p>
 * A message produced at step {@code S} is visible at step {@code C} when it
 * has not been excluded and either its type keeps every step (window
 * {@code 0}) or {@code C - S} is smaller than the window of its type. Types
 * without a configured window fall back to {@link #DEFAULT_KEEP_STEPS}.
 * Messages from a step later than {@code C} are never visible, whatever the
 * window.
 *
 * <p>
 * Exclusion is final: once an id has been excluded it is never returned
 * again, even if a message with that id is added later or the history is
 * cleared and re-hydrated.
 *
 * <p>
 * All operations are thread-safe.
 *
 * @since 1.0
 */
@Slf4j
public class ChatHistoryManager {

    public static final int DEFAULT_KEEP_STEPS = 5;

    private static final Comparator<ChatMessage> BY_STEP = Comparator.comparingInt(ChatMessage::getStep);

    private final Clock clock;
    private final List<ChatMessage> messages = new ArrayList<>();
    private final Set<String> excludedIds = new HashSet<>();
    private ChatHistoryConfig config;

    public ChatHistoryManager(ChatHistoryConfig config, Clock clock) {
        validateConfig(config != null ? config.asMap() : Map.of());
        this.config = config != null ? config : ChatHistoryConfig.defaults();
        this.clock = clock;
    }

    public ChatHistoryManager(Clock clock) {
        this(ChatHistoryConfig.defaults(), clock);
    }

    /**
     * Layer the given windows over the current configuration.
     */
    public synchronized void setConfig(Map<MessageType, Integer> partial) {
        validateConfig(partial);
        this.config = config.merge(partial);
        log.debug("[History] Retention updated: {}", config);
    }

    public synchronized ChatHistoryConfig getConfig() {
        return config;
    }

    /**
     * Change the window of exactly one message type.
     */
    public synchronized void updateTypeConfig(MessageType type, int keepSteps) {
        if (type == null) {
            throw new ValidationException("Message type is required");
        }
        validateWindow(type, keepSteps);
        this.config = config.with(type, keepSteps);
    }

    /**
     * Store a message, assigning it a fresh id and the current time. Any id or
     * timestamp already present on the argument is replaced.
     */
    public synchronized ChatMessage addMessage(ChatMessage message) {
        validateMessage(message);
        ChatMessage stored = message.toBuilder()
                .id(UUID.randomUUID().toString())
                .type(message.getType() != null ? message.getType() : MessageType.MESSAGE)
                .timestamp(clock.instant())
                .build();
        messages.add(stored);
        return stored;
    }

    /**
     * Store a message that already carries its identity, keeping id and
     * timestamp as they are.
     */
    public synchronized ChatMessage addCompleteMessage(ChatMessage message) {
        validateMessage(message);
        if (message.getId() == null || message.getId().isBlank()) {
            throw new ValidationException("Complete message requires an id");
        }
        if (message.getTimestamp() == null) {
            throw new ValidationException("Complete message requires a timestamp");
        }
        ChatMessage stored = message.getType() != null ? message
                : message.toBuilder().type(MessageType.MESSAGE).build();
        messages.add(stored);
        return stored;
    }

    /**
     * Every stored message in insertion order, excluded or not.
     */
    public synchronized List<ChatMessage> getChatHistory() {
        return List.copyOf(messages);
    }

    public synchronized void clearChatHistory() {
        int removed = messages.size();
        messages.clear();
        log.debug("[History] Cleared {} messages", removed);
    }

    /**
     * Messages visible at {@code currentStep}, ordered by step and then by
     * insertion.
     */
    public synchronized List<ChatMessage> getFilteredChatHistory(int currentStep) {
        if (currentStep < 0) {
            throw new ValidationException("Current step must not be negative: " + currentStep);
        }
        List<ChatMessage> visible = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (isVisible(message, currentStep)) {
                visible.add(message);
            }
        }
        visible.sort(BY_STEP);
        return visible;
    }

    /**
     * Permanently hide a message. Unknown ids are remembered too, so a message
     * added later under that id stays hidden.
     */
    public synchronized void excludeChatHistory(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            throw new ValidationException("Message id is required");
        }
        if (excludedIds.add(messageId)) {
            log.debug("[History] Excluded message {}", messageId);
        }
    }

    public synchronized void excludeChatHistoryBatch(Collection<String> messageIds) {
        if (messageIds == null || messageIds.isEmpty()) {
            throw new ValidationException("At least one message id is required");
        }
        for (String messageId : messageIds) {
            if (messageId == null || messageId.isBlank()) {
                throw new ValidationException("Message ids must not be blank");
            }
        }
        excludedIds.addAll(messageIds);
        log.debug("[History] Excluded {} messages", messageIds.size());
    }

    public synchronized Set<String> getExcludedIds() {
        return Set.copyOf(excludedIds);
    }

    public synchronized boolean isExcluded(String messageId) {
        return excludedIds.contains(messageId);
    }

    public synchronized int size() {
        return messages.size();
    }

    private boolean isVisible(ChatMessage message, int currentStep) {
        if (message.getId() != null && excludedIds.contains(message.getId())) {
            return false;
        }
        int age = currentStep - message.getStep();
        if (age < 0) {
            return false;
        }
        int keepSteps = config.keepSteps(message.getType()).orElse(DEFAULT_KEEP_STEPS);
        return keepSteps == 0 || age < keepSteps;
    }

    private static void validateMessage(ChatMessage message) {
        if (message == null) {
            throw new ValidationException("Message is required");
        }
        if (message.getRole() == null) {
            throw new ValidationException("Message role is required");
        }
        if (message.getStep() < 0) {
            throw new ValidationException("Message step must not be negative: " + message.getStep());
        }
    }

    private static void validateConfig(Map<MessageType, Integer> windows) {
        if (windows == null) {
            return;
        }
        windows.forEach(ChatHistoryManager::validateWindow);
    }

    private static void validateWindow(MessageType type, Integer keepSteps) {
        if (keepSteps == null || keepSteps < 0) {
            throw new ValidationException("Retention window for " + type + " must be zero or positive");
        }
    }
}
