package me.reasonloop.runtime.domain.exception;

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

import me.reasonloop.runtime.domain.model.AgentStatus;
import lombok.Getter;

/**
 * Raised when an agent is asked to move between two statuses that are not
 * connected in its lifecycle.
 */
@Getter
public class IllegalStateTransitionException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final AgentStatus from;
    private final AgentStatus to;

    public IllegalStateTransitionException(AgentStatus from, AgentStatus to) {
        super("Illegal agent status transition: " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }
}
