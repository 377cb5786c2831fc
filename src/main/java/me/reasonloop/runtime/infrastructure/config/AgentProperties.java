package me.reasonloop.runtime.infrastructure.config;

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

import me.reasonloop.runtime.domain.model.ExecutionMode;
import me.reasonloop.runtime.domain.model.MessageType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the runtime, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code reasonloop.*} prefix:
 * <ul>
 * <li>{@link EventBusProperties} - history size, statistics window, auto
 * start</li>
 * <li>{@link AgentLoopProperties} - step limit, default execution mode, tool
 * timeout</li>
 * <li>{@link InteractionProperties} - round-trip timeouts</li>
 * <li>{@link ToolsProperties} - tools treated as side-effecting</li>
 * <li>{@link ChatHistoryProperties} - retention overrides per message type</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "reasonloop")
@Data
public class AgentProperties {

    private EventBusProperties eventBus = new EventBusProperties();
    private AgentLoopProperties agent = new AgentLoopProperties();
    private InteractionProperties interaction = new InteractionProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ChatHistoryProperties chatHistory = new ChatHistoryProperties();

    @Data
    public static class EventBusProperties {
        private int maxHistorySize = 10_000;
        private int statsWindow = 100;
        private boolean autoStart = true;
    }

    @Data
    public static class AgentLoopProperties {
        private int maxSteps = 20;
        private ExecutionMode executionMode = ExecutionMode.MANUAL;
        private Duration toolTimeout = Duration.ofSeconds(30);
        private String systemPrompt = "You are a helpful agent. Think inside <think> and answer inside "
                + "<interactive><response>...</response></interactive>. "
                + "Add <stop_signal>done</stop_signal> when the task is complete.";
    }

    @Data
    public static class InteractionProperties {
        private Duration approvalTimeout = Duration.ofSeconds(30);
        private Duration inputTimeout = Duration.ofSeconds(60);
        private Duration modeChangeTimeout = Duration.ofSeconds(5);
        private Duration collaborationTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class ToolsProperties {
        private List<String> sideEffecting = new ArrayList<>(List.of("shell", "filesystem", "git", "http"));
    }

    @Data
    public static class ChatHistoryProperties {
        private Map<MessageType, Integer> keepSteps = new EnumMap<>(MessageType.class);
    }
}
