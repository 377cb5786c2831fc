package me.reasonloop.runtime.domain.prompt;

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
import me.reasonloop.runtime.domain.history.ChatHistoryManager;
import me.reasonloop.runtime.domain.model.AgentStep;
import me.reasonloop.runtime.domain.model.ChatMessage;
import me.reasonloop.runtime.domain.model.ChatRole;
import me.reasonloop.runtime.domain.model.ExtractorResult;
import me.reasonloop.runtime.domain.model.MessageType;
import me.reasonloop.runtime.domain.model.ToolExecutionResult;
import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Turns everything an agent observes into chat history and assembles the
 * prompt for each step from the history visible at that step.
 *
 * <p>
 * The assembled prompt has three parts: the system prompt, one
 * {@code <chat_history>} block per visible message and a marker of the
 * current step. Prompts are kept per step so they can be inspected after a
 * run.
 *
 * @since 1.0
 */
@Slf4j
public class PromptProcessor {

    private final ChatHistoryManager chatHistoryManager;
    private final ResponseExtractor responseExtractor;
    private final ObjectMapper objectMapper;
    private final List<String> stepPrompts = new ArrayList<>();

    private volatile String systemPrompt;
    private volatile boolean stopSignalReceived;
    private volatile String finalAnswer;

    public PromptProcessor(String systemPrompt, ChatHistoryManager chatHistoryManager,
            ResponseExtractor responseExtractor, ObjectMapper objectMapper) {
        this.systemPrompt = systemPrompt != null ? systemPrompt : "";
        this.chatHistoryManager = chatHistoryManager;
        this.responseExtractor = responseExtractor;
        this.objectMapper = objectMapper;
    }

    public ChatHistoryManager getChatHistoryManager() {
        return chatHistoryManager;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt != null ? systemPrompt : "";
    }

    public ExtractorResult extract(String responseText) {
        return responseExtractor.extract(responseText);
    }

    public ChatMessage renderUserMessage(String content, int step) {
        return chatHistoryManager.addMessage(ChatMessage.of(ChatRole.USER, MessageType.MESSAGE, step, content));
    }

    /**
     * Record messages produced elsewhere. Messages that already carry id and
     * timestamp keep them.
     */
    public void renderChatMessages(Collection<ChatMessage> messages) {
        for (ChatMessage message : messages) {
            if (message.getId() != null && message.getTimestamp() != null) {
                chatHistoryManager.addCompleteMessage(message);
            } else {
                chatHistoryManager.addMessage(message);
            }
        }
    }

    public void renderExtractorResult(ExtractorResult result, int step) {
        if (result == null) {
            return;
        }
        addAgentMessage(MessageType.ANALYSIS, step, result.analysis(), "analysis");
        addAgentMessage(MessageType.PLAN, step, result.plan(), "plan");
        addAgentMessage(MessageType.REASONING, step, result.reasoning(), "reasoning");
        addAgentMessage(MessageType.RESPONSE, step, result.response(), "response");
        if (result.isStopRequested()) {
            addAgentMessage(MessageType.STOP_SIGNAL, step, result.stopSignal(), "stop_signal");
            this.stopSignalReceived = true;
            this.finalAnswer = result.response() != null ? result.response() : result.stopSignal();
        }
    }

    /**
     * One history message per result so each can be excluded on its own.
     */
    public List<ChatMessage> renderToolResults(List<ToolExecutionResult> results, int step) {
        List<ChatMessage> rendered = new ArrayList<>();
        if (results == null) {
            return rendered;
        }
        for (ToolExecutionResult result : results) {
            String content = "<tool_call_result name=\"" + result.getName() + "\" call_id=\""
                    + result.getCallId() + "\">\n"
                    + "params=" + toJson(result.getArguments()) + "\n"
                    + "result=" + toJson(result.getResult()) + "\n"
                    + "status=" + result.getStatus().getValue() + "\n"
                    + "message=" + (result.getMessage() != null ? result.getMessage() : "") + "\n"
                    + "</tool_call_result>";
            rendered.add(chatHistoryManager.addMessage(
                    ChatMessage.of(ChatRole.AGENT, MessageType.TOOL_CALL, step, content)));
        }
        return rendered;
    }

    public ChatMessage renderError(String error, int step) {
        return chatHistoryManager.addMessage(
                ChatMessage.of(ChatRole.SYSTEM, MessageType.ERROR, step, "<error>" + error + "</error>"));
    }

    public void processStepResult(AgentStep step) {
        renderExtractorResult(step.getExtractorResult(), step.getStepIndex());
        renderToolResults(step.getToolExecutionResults(), step.getStepIndex());
    }

    /**
     * Assemble the prompt for {@code stepIndex} and remember it. Formatting the
     * same step again replaces the remembered prompt.
     */
    public synchronized String formatPrompt(int stepIndex) {
        if (stepIndex < 0) {
            throw new ValidationException("Step index must not be negative: " + stepIndex);
        }
        StringBuilder prompt = new StringBuilder();
        prompt.append(systemPrompt).append("\n\n");

        List<ChatMessage> visible = chatHistoryManager.getFilteredChatHistory(stepIndex);
        if (!visible.isEmpty()) {
            prompt.append("## Chat History List\n");
            for (ChatMessage message : visible) {
                prompt.append("<chat_history>\n")
                        .append("id: ").append(message.getId()).append('\n')
                        .append("step: ").append(message.getStep()).append('\n')
                        .append("type: ").append(message.getType().getValue()).append('\n')
                        .append("timestamp: ").append(message.getTimestamp()).append('\n')
                        .append(message.getRole().getValue()).append(": ").append(message.getContent()).append('\n')
                        .append("</chat_history>\n");
            }
        }
        prompt.append("\n## Current Step\nstep: ").append(stepIndex).append('\n');

        String assembled = prompt.toString();
        if (stepIndex < stepPrompts.size()) {
            stepPrompts.set(stepIndex, assembled);
        } else {
            while (stepPrompts.size() < stepIndex) {
                stepPrompts.add("");
            }
            stepPrompts.add(assembled);
        }
        log.debug("[Prompt] Step {} prompt assembled from {} messages", stepIndex, visible.size());
        return assembled;
    }

    public synchronized String getStepPrompt(int stepIndex) {
        if (stepIndex < 0 || stepIndex >= stepPrompts.size()) {
            throw new ValidationException("Step index " + stepIndex + " is out of range (available: "
                    + stepPrompts.size() + ")");
        }
        return stepPrompts.get(stepIndex);
    }

    public synchronized List<String> getStepPrompts() {
        return List.copyOf(stepPrompts);
    }

    /**
     * Prompts of steps {@code start} to {@code end}, both inclusive. An end past
     * the last assembled step is cut to it.
     */
    public synchronized List<String> getStepPrompts(int start, int end) {
        if (start < 0 || end < 0) {
            throw new ValidationException("Step range start and end must not be negative");
        }
        if (start > end) {
            throw new ValidationException("Step range start must not exceed end");
        }
        if (start >= stepPrompts.size()) {
            throw new ValidationException("Step range start " + start + " is out of range (available: "
                    + stepPrompts.size() + ")");
        }
        int lastIncluded = Math.min(end, stepPrompts.size() - 1);
        return List.copyOf(stepPrompts.subList(start, lastIncluded + 1));
    }

    public boolean isStopSignalReceived() {
        return stopSignalReceived;
    }

    public String getFinalAnswer() {
        return finalAnswer;
    }

    /**
     * Forget history, assembled prompts and the stop signal. The system prompt
     * stays.
     */
    public synchronized void reset() {
        chatHistoryManager.clearChatHistory();
        stepPrompts.clear();
        stopSignalReceived = false;
        finalAnswer = null;
    }

    public synchronized PromptProcessorStats stats(int currentStep) {
        int total = chatHistoryManager.size();
        int visible = chatHistoryManager.getFilteredChatHistory(Math.max(currentStep, 0)).size();
        return new PromptProcessorStats(total, visible, chatHistoryManager.getExcludedIds().size(),
                stepPrompts.size(), stopSignalReceived, finalAnswer);
    }

    private void addAgentMessage(MessageType type, int step, String content, String tag) {
        if (content == null || content.isBlank()) {
            return;
        }
        chatHistoryManager.addMessage(
                ChatMessage.of(ChatRole.AGENT, type, step, "<" + tag + ">" + content + "</" + tag + ">"));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[Prompt] Failed to serialize tool value, falling back to toString: {}", e.getMessage());
            return String.valueOf(value);
        }
    }
}
