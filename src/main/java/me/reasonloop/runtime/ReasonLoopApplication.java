package me.reasonloop.runtime;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the ReasonLoop agent runtime.
 *
 * <p>
 * ReasonLoop is an event-driven core for step-based AI agents: agents, users
 * and interactive clients talk to each other only through an in-process event
 * bus.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Event Bus</b> - typed events, filtered and session-scoped delivery,
 * bounded history, statistics</li>
 * <li><b>Chat History</b> - per-type retention windows and permanent
 * exclusion</li>
 * <li><b>Agent Loop</b> - lifecycle state machine, cooperative stop, stop
 * signals from the model</li>
 * <li><b>Execution Modes</b> - auto, manual and supervised tool approval with
 * timeouts</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → AgentLoop, ChatHistoryManager, PromptProcessor, Services
 * Ports              → LlmPort, ToolPort
 * Infrastructure     → InMemoryEventBus, configuration
 * Adapters           → EventLogSubscriber
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code reasonloop.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReasonLoopApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReasonLoopApplication.class, args);
    }

}
