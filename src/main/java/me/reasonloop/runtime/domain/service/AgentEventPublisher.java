package me.reasonloop.runtime.domain.service;

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
import me.reasonloop.runtime.domain.model.AgentStatus;
import me.reasonloop.runtime.domain.model.BusEvent;
import me.reasonloop.runtime.domain.model.EventSource;
import me.reasonloop.runtime.domain.model.ExtractorResult;
import me.reasonloop.runtime.domain.model.PendingEvent;
import me.reasonloop.runtime.domain.model.StepAction;
import me.reasonloop.runtime.domain.model.ToolExecutionResult;
import me.reasonloop.runtime.domain.model.event.AgentReply;
import me.reasonloop.runtime.domain.model.event.AgentStateChange;
import me.reasonloop.runtime.domain.model.event.AgentStepEvent;
import me.reasonloop.runtime.domain.model.event.AgentThinking;
import me.reasonloop.runtime.domain.model.event.ErrorOccurred;
import me.reasonloop.runtime.domain.model.event.EventPayload;
import me.reasonloop.runtime.domain.model.event.SessionLifecycle;
import me.reasonloop.runtime.domain.model.event.ToolExecutionResultEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Emits the events an agent produces while it runs. Every emit waits until the
 * bus has delivered the event to all its handlers, so observers see an
 * agent's events in the order they happened.
 */
@Service
@RequiredArgsConstructor
public class AgentEventPublisher {

    private final EventBus eventBus;

    public BusEvent emit(String sessionId, EventPayload payload) {
        return eventBus.publish(PendingEvent.of(EventSource.AGENT, sessionId, payload)).join();
    }

    public BusEvent stateChanged(String sessionId, String agentId, AgentStatus from, AgentStatus to, String reason,
            int currentStep) {
        return emit(sessionId, new AgentStateChange(agentId, from, to, reason, currentStep));
    }

    public BusEvent stepStarted(String sessionId, String agentId, int stepIndex) {
        return emit(sessionId, new AgentStepEvent(agentId, stepIndex, StepAction.START, null));
    }

    public BusEvent stepCompleted(String sessionId, String agentId, int stepIndex) {
        return emit(sessionId, new AgentStepEvent(agentId, stepIndex, StepAction.COMPLETE, null));
    }

    public BusEvent stepFailed(String sessionId, String agentId, int stepIndex, String error) {
        return emit(sessionId, new AgentStepEvent(agentId, stepIndex, StepAction.ERROR, error));
    }

    public BusEvent thinking(String sessionId, int stepIndex, ExtractorResult result) {
        return emit(sessionId, new AgentThinking(stepIndex, result.analysis(), result.plan(), result.reasoning()));
    }

    public BusEvent reply(String sessionId, String content, boolean finalReply) {
        return emit(sessionId, new AgentReply(content, finalReply ? AgentReply.FINAL : AgentReply.TEXT));
    }

    public BusEvent toolResult(String sessionId, ToolExecutionResult result) {
        return emit(sessionId, new ToolExecutionResultEvent(result.getName(), result.getCallId(),
                result.isSuccess(), result.getResult(), result.isSuccess() ? null : result.getMessage(),
                result.getExecutionTime()));
    }

    public BusEvent sessionStarted(String sessionId, String agentId, String userInput, int maxSteps) {
        return emit(sessionId, SessionLifecycle.sessionStarted(agentId, userInput, maxSteps));
    }

    public BusEvent sessionEnded(String sessionId, String agentId, int stepsCompleted) {
        return emit(sessionId, SessionLifecycle.sessionEnded(agentId, stepsCompleted));
    }

    public BusEvent errorOccurred(String sessionId, String agentId, String errorType, Throwable error,
            Map<String, Object> context) {
        Map<String, Object> safeContext = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        safeContext.put("agentId", agentId);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return eventBus.publish(PendingEvent.of(EventSource.ERROR_HANDLER, sessionId,
                new ErrorOccurred(UUID.randomUUID().toString(), errorType, message, safeContext))).join();
    }
}
