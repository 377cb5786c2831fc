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

import me.reasonloop.runtime.domain.model.ChatHistoryConfig;
import me.reasonloop.runtime.domain.model.ExecutionMode;
import lombok.Builder;
import lombok.Data;

/**
 * Configuration parameters of one agent: identity, default step limit,
 * starting execution mode, system prompt and chat history retention.
 */
@Data
@Builder
public class AgentLoopConfig {

    private String agentId;

    @Builder.Default
    private String name = "agent";

    @Builder.Default
    private int maxSteps = 20;

    @Builder.Default
    private ExecutionMode executionMode = ExecutionMode.MANUAL;

    @Builder.Default
    private String systemPrompt = "";

    @Builder.Default
    private ChatHistoryConfig chatHistoryConfig = ChatHistoryConfig.defaults();

    public static AgentLoopConfig defaultConfig() {
        return AgentLoopConfig.builder().build();
    }
}
