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

import me.reasonloop.runtime.domain.exception.IllegalStateTransitionException;
import me.reasonloop.runtime.domain.model.AgentStatus;

/**
 * Holds an agent's status and rejects transitions its lifecycle does not
 * allow.
 */
public class AgentStateMachine {

    private AgentStatus status = AgentStatus.IDLE;

    public synchronized AgentStatus current() {
        return status;
    }

    /**
     * Move to {@code target}.
     *
     * @return the previous status
     * @throws IllegalStateTransitionException
     *             if the transition is not allowed
     */
    public synchronized AgentStatus transition(AgentStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateTransitionException(status, target);
        }
        AgentStatus previous = status;
        status = target;
        return previous;
    }

    /**
     * Move to {@code target} only if the current status is {@code expected}.
     */
    public synchronized boolean transitionIf(AgentStatus expected, AgentStatus target) {
        if (status != expected || !status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        return true;
    }
}
