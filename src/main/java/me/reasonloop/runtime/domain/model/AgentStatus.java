package me.reasonloop.runtime.domain.model;

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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of an agent.
 *
 * <p>
 * Allowed transitions:
 *
 * <pre>
 * IDLE -> INITIALIZING -> RUNNING -> STOPPING -> IDLE
 *         INITIALIZING -> ERROR
 *                         RUNNING -> ERROR
 *                                    STOPPING -> ERROR
 *                                                ERROR -> IDLE (reset)
 * </pre>
 */
public enum AgentStatus {

    IDLE, INITIALIZING, RUNNING, STOPPING, ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean canTransitionTo(AgentStatus target) {
        return allowedTargets().contains(target);
    }

    public Set<AgentStatus> allowedTargets() {
        return switch (this) {
        case IDLE -> EnumSet.of(INITIALIZING);
        case INITIALIZING -> EnumSet.of(RUNNING, ERROR);
        case RUNNING -> EnumSet.of(STOPPING, ERROR);
        case STOPPING -> EnumSet.of(IDLE, ERROR);
        case ERROR -> EnumSet.of(IDLE);
        };
    }
}
