package me.reasonloop.runtime.domain.loop;

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

import me.reasonloop.runtime.domain.bus.EventBus;
import me.reasonloop.runtime.domain.component.ToolComponent;
import me.reasonloop.runtime.domain.history.ChatHistoryManager;
import me.reasonloop.runtime.domain.model.ChatHistoryConfig;
import me.reasonloop.runtime.domain.prompt.PromptProcessor;
import me.reasonloop.runtime.domain.prompt.ResponseExtractor;
import me.reasonloop.runtime.domain.service.AgentEventPublisher;
import me.reasonloop.runtime.domain.service.InteractionService;
import me.reasonloop.runtime.domain.service.ToolApprovalPolicy;
import me.reasonloop.runtime.domain.service.ToolCallExecutionService;
import me.reasonloop.runtime.infrastructure.config.AgentProperties;
import me.reasonloop.runtime.port.outbound.LlmPort;
import me.reasonloop.runtime.port.outbound.ToolPort;
import me.reasonloop.runtime.tools.ExcludeChatHistoryTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Builds agents wired to the shared event bus and services. Each agent gets
 * its own chat history, prompt processor and built-in tools.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentFactory {

    private final EventBus eventBus;
    private final AgentEventPublisher agentEventPublisher;
    private final InteractionService interactionService;
    private final ToolApprovalPolicy toolApprovalPolicy;
    private final ToolCallExecutionService toolCallExecutionService;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AgentLoop create(String name, LlmPort llmPort, ToolPort toolPort) {
        return create(defaultConfig(name), llmPort, toolPort);
    }

    public AgentLoop create(AgentLoopConfig config, LlmPort llmPort, ToolPort toolPort) {
        if (config.getAgentId() == null || config.getAgentId().isBlank()) {
            config.setAgentId(UUID.randomUUID().toString());
        }
        ChatHistoryManager chatHistoryManager = new ChatHistoryManager(config.getChatHistoryConfig(), clock);
        PromptProcessor promptProcessor = new PromptProcessor(config.getSystemPrompt(), chatHistoryManager,
                new ResponseExtractor(), objectMapper);
        List<ToolComponent> builtinTools = List.of(new ExcludeChatHistoryTool(chatHistoryManager));

        log.debug("[AgentFactory] Creating agent {} ({})", config.getName(), config.getAgentId());
        return new AgentLoop(config, eventBus, agentEventPublisher, interactionService, toolApprovalPolicy,
                toolCallExecutionService, llmPort, toolPort, promptProcessor, builtinTools, clock);
    }

    /**
     * Agent configuration taken from {@code reasonloop.agent.*} and
     * {@code reasonloop.chat-history.*}.
     */
    public AgentLoopConfig defaultConfig(String name) {
        AgentProperties.AgentLoopProperties agent = properties.getAgent();
        return AgentLoopConfig.builder()
                .agentId(UUID.randomUUID().toString())
                .name(name != null ? name : "agent")
                .maxSteps(agent.getMaxSteps())
                .executionMode(agent.getExecutionMode())
                .systemPrompt(agent.getSystemPrompt())
                .chatHistoryConfig(ChatHistoryConfig.defaults().merge(properties.getChatHistory().getKeepSteps()))
                .build();
    }
}
