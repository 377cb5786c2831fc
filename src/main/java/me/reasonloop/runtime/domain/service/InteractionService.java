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
import me.reasonloop.runtime.domain.exception.ValidationException;
import me.reasonloop.runtime.domain.model.ApprovalDecision;
import me.reasonloop.runtime.domain.model.ApprovalOutcome;
import me.reasonloop.runtime.domain.model.EventFilter;
import me.reasonloop.runtime.domain.model.EventSource;
import me.reasonloop.runtime.domain.model.EventTypes;
import me.reasonloop.runtime.domain.model.ExecutionMode;
import me.reasonloop.runtime.domain.model.InputOutcome;
import me.reasonloop.runtime.domain.model.PendingEvent;
import me.reasonloop.runtime.domain.model.SubscriptionConfig;
import me.reasonloop.runtime.domain.model.event.ApprovalRequest;
import me.reasonloop.runtime.domain.model.event.ApprovalResponse;
import me.reasonloop.runtime.domain.model.event.CollaborationRequest;
import me.reasonloop.runtime.domain.model.event.CollaborationResponse;
import me.reasonloop.runtime.domain.model.event.EventPayload;
import me.reasonloop.runtime.domain.model.event.ExecutionModeChangeRequest;
import me.reasonloop.runtime.domain.model.event.ExecutionModeChangeResponse;
import me.reasonloop.runtime.domain.model.event.InputRequest;
import me.reasonloop.runtime.domain.model.event.InputResponse;
import me.reasonloop.runtime.domain.model.event.RequestTimeout;
import me.reasonloop.runtime.infrastructure.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Request/response round-trips over the event bus: approvals, user input and
 * execution mode changes.
 *
 * <p>
 * Each round-trip subscribes to the response type for the session before the
 * request is published, matches the response by request id and unsubscribes
 * once it is resolved. Unanswered requests resolve to a conservative default
 * after their timeout and leave a {@code request_timeout} event behind:
 * <ul>
 * <li>approval - rejected
 * <li>input - cancelled
 * <li>mode change - mode left unchanged, the future fails
 * <li>collaboration - completes with an empty reply
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code reasonloop.interaction.approval-timeout}
 * <li>{@code reasonloop.interaction.input-timeout}
 * <li>{@code reasonloop.interaction.mode-change-timeout}
 * <li>{@code reasonloop.interaction.collaboration-timeout}
 * </ul>
 */
@Service
@Slf4j
public class InteractionService {

    static final String RESOLUTION_REJECTED = "rejected";
    static final String RESOLUTION_CANCELLED = "cancelled";
    static final String RESOLUTION_MODE_UNCHANGED = "mode_unchanged";
    static final String RESOLUTION_UNANSWERED = "unanswered";

    private final EventBus eventBus;
    private final AgentProperties.InteractionProperties settings;
    private final Map<String, String> pending = new ConcurrentHashMap<>();

    public InteractionService(EventBus eventBus, AgentProperties properties) {
        this.eventBus = eventBus;
        this.settings = properties.getInteraction();
    }

    /**
     * Ask for a decision on an action. Completes with
     * {@link ApprovalDecision#REJECT} when nobody answers in time.
     */
    public CompletableFuture<ApprovalOutcome> requestApproval(String sessionId, ApprovalRequest request) {
        String requestId = ensureRequestId(request.requestId());
        ApprovalRequest effective = request.toBuilder().requestId(requestId).build();
        Duration timeout = resolveTimeout(effective.timeout(), settings.getApprovalTimeout());

        CompletableFuture<ApprovalResponse> response = awaitResponse(sessionId, EventTypes.APPROVAL_RESPONSE,
                requestId, ApprovalResponse.class, ApprovalResponse::requestId);
        publishRequest(EventSource.AGENT, sessionId, effective, response);
        log.info("[Interaction] Approval {} requested: {}", requestId, effective.description());

        return response.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((answer, error) -> {
                    if (error == null) {
                        ApprovalDecision decision = answer.decision() != null ? answer.decision()
                                : ApprovalDecision.REJECT;
                        log.info("[Interaction] Approval {} answered: {}", requestId, decision);
                        return new ApprovalOutcome(requestId, decision, answer.modification(), false);
                    }
                    if (isTimeout(error)) {
                        log.warn("[Interaction] Approval {} timed out after {}, rejecting", requestId, timeout);
                        publishTimeout(sessionId, requestId, EventTypes.APPROVAL_REQUEST, timeout,
                                RESOLUTION_REJECTED);
                        return ApprovalOutcome.timeout(requestId);
                    }
                    log.error("[Interaction] Approval {} failed, rejecting", requestId, error);
                    return new ApprovalOutcome(requestId, ApprovalDecision.REJECT, null, false);
                });
    }

    /**
     * Ask the user for a value. Completes as cancelled when nobody answers in
     * time.
     */
    public CompletableFuture<InputOutcome> requestInput(String sessionId, InputRequest request) {
        String requestId = ensureRequestId(request.requestId());
        InputRequest effective = request.toBuilder().requestId(requestId).build();
        Duration timeout = resolveTimeout(effective.timeout(), settings.getInputTimeout());

        CompletableFuture<InputResponse> response = awaitResponse(sessionId, EventTypes.INPUT_RESPONSE, requestId,
                InputResponse.class, InputResponse::requestId);
        publishRequest(EventSource.AGENT, sessionId, effective, response);
        log.info("[Interaction] Input {} requested: {}", requestId, effective.prompt());

        return response.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((answer, error) -> {
                    if (error == null) {
                        return new InputOutcome(requestId, answer.value(), answer.cancelled(), false);
                    }
                    if (isTimeout(error)) {
                        log.warn("[Interaction] Input {} timed out after {}, cancelling", requestId, timeout);
                        publishTimeout(sessionId, requestId, EventTypes.INPUT_REQUEST, timeout,
                                RESOLUTION_CANCELLED);
                        return InputOutcome.timeout(requestId);
                    }
                    log.error("[Interaction] Input {} failed, cancelling", requestId, error);
                    return new InputOutcome(requestId, null, true, false);
                });
    }

    /**
     * Ask the agent of a session to switch modes. Completes with the mode the
     * agent confirmed; fails with {@link ValidationException} when the agent
     * rejects the change or does not answer in time.
     */
    public CompletableFuture<ExecutionMode> requestModeChange(String sessionId, ExecutionMode fromMode,
            ExecutionMode toMode, String reason) {
        if (toMode == null) {
            throw new ValidationException("Target execution mode is required");
        }
        String requestId = UUID.randomUUID().toString();
        Duration timeout = settings.getModeChangeTimeout();
        ExecutionModeChangeRequest request = ExecutionModeChangeRequest.builder()
                .requestId(requestId)
                .fromMode(fromMode)
                .toMode(toMode)
                .reason(reason)
                .build();

        CompletableFuture<ExecutionModeChangeResponse> response = awaitResponse(sessionId,
                EventTypes.EXECUTION_MODE_CHANGE_RESPONSE, requestId, ExecutionModeChangeResponse.class,
                ExecutionModeChangeResponse::requestId);
        publishRequest(EventSource.USER, sessionId, request, response);
        log.info("[Interaction] Mode change {} requested: {} -> {}", requestId, fromMode, toMode);

        return response.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((answer, error) -> {
                    if (error == null) {
                        if (!answer.success()) {
                            throw new ValidationException("Mode change rejected: " + answer.error());
                        }
                        return answer.mode();
                    }
                    if (isTimeout(error)) {
                        log.warn("[Interaction] Mode change {} not confirmed within {}", requestId, timeout);
                        publishTimeout(sessionId, requestId, EventTypes.EXECUTION_MODE_CHANGE_REQUEST, timeout,
                                RESOLUTION_MODE_UNCHANGED);
                        throw new ValidationException("Mode change to " + toMode + " not confirmed within " + timeout);
                    }
                    throw new CompletionException(error);
                });
    }

    /**
     * Ask a human collaborator for help with a problem the agent is stuck on.
     */
    public CompletableFuture<CollaborationResponse> requestCollaboration(String sessionId,
            CollaborationRequest request) {
        String requestId = ensureRequestId(request.requestId());
        CollaborationRequest effective = new CollaborationRequest(requestId, request.problem(),
                request.attemptedSolutions(), request.context());
        Duration timeout = resolveTimeout(null, settings.getCollaborationTimeout());

        CompletableFuture<CollaborationResponse> response = awaitResponse(sessionId,
                EventTypes.COLLABORATION_RESPONSE, requestId, CollaborationResponse.class,
                CollaborationResponse::requestId);
        publishRequest(EventSource.AGENT, sessionId, effective, response);
        log.info("[Interaction] Collaboration {} requested: {}", requestId, effective.problem());

        return response.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((answer, error) -> {
                    if (error == null) {
                        return answer;
                    }
                    if (isTimeout(error)) {
                        log.warn("[Interaction] Collaboration {} unanswered after {}", requestId, timeout);
                        publishTimeout(sessionId, requestId, EventTypes.COLLABORATION_REQUEST, timeout,
                                RESOLUTION_UNANSWERED);
                    } else {
                        log.error("[Interaction] Collaboration {} failed", requestId, error);
                    }
                    return new CollaborationResponse(requestId, null);
                });
    }

    public CompletableFuture<?> respondToCollaboration(String sessionId, String requestId, String reply) {
        return eventBus.publish(PendingEvent.of(EventSource.USER, sessionId, new CollaborationResponse(requestId,
                reply)));
    }

    /**
     * Publish the answer to an approval request on behalf of a client.
     */
    public CompletableFuture<?> respondToApproval(String sessionId, String requestId, ApprovalDecision decision,
            String modification) {
        return eventBus.publish(PendingEvent.of(EventSource.USER, sessionId,
                new ApprovalResponse(requestId, decision, modification, false)));
    }

    /**
     * Publish the answer to an input request on behalf of a client.
     */
    public CompletableFuture<?> respondToInput(String sessionId, String requestId, String value,
            boolean cancelled) {
        return eventBus.publish(PendingEvent.of(EventSource.USER, sessionId,
                new InputResponse(requestId, value, cancelled, null)));
    }

    /**
     * Unresolved request ids mapped to the response type they wait for.
     */
    public Map<String, String> getPendingRequests() {
        return Map.copyOf(pending);
    }

    private <T extends EventPayload> CompletableFuture<T> awaitResponse(String sessionId, String responseType,
            String requestId, Class<T> payloadType, Function<T, String> requestIdOf) {
        CompletableFuture<T> future = new CompletableFuture<>();
        String subscriptionId = eventBus.subscribe(responseType, event -> {
            T payload = event.payloadAs(payloadType);
            if (payload != null && requestId.equals(requestIdOf.apply(payload))) {
                future.complete(payload);
            }
        }, SubscriptionConfig.filtered(EventFilter.forSession(sessionId)));
        pending.put(requestId, responseType);
        future.whenComplete((ignored, error) -> {
            pending.remove(requestId);
            eventBus.unsubscribe(subscriptionId);
        });
        return future;
    }

    private void publishRequest(EventSource source, String sessionId, EventPayload request,
            CompletableFuture<?> response) {
        try {
            eventBus.publish(PendingEvent.of(source, sessionId, request));
        } catch (RuntimeException e) {
            response.cancel(false);
            throw e;
        }
    }

    private void publishTimeout(String sessionId, String requestId, String requestType, Duration timeout,
            String resolution) {
        try {
            eventBus.publish(PendingEvent.of(EventSource.INTERACTION_HUB, sessionId,
                    new RequestTimeout(requestId, requestType, timeout, resolution)));
        } catch (RuntimeException e) {
            log.warn("[Interaction] Could not record timeout of {}: {}", requestId, e.getMessage());
        }
    }

    private static String ensureRequestId(String requestId) {
        return requestId != null && !requestId.isBlank() ? requestId : UUID.randomUUID().toString();
    }

    private static Duration resolveTimeout(Duration requested, Duration fallback) {
        Duration timeout = requested != null ? requested : fallback;
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ValidationException("Round-trip timeout must be positive: " + timeout);
        }
        return timeout;
    }

    private static boolean isTimeout(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause()
                : error;
        return cause instanceof TimeoutException;
    }
}
