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
import me.reasonloop.runtime.domain.exception.IllegalStateTransitionException;
import me.reasonloop.runtime.domain.exception.NotRunningException;
import me.reasonloop.runtime.domain.exception.StepFailureException;
import me.reasonloop.runtime.domain.exception.ValidationException;
import me.reasonloop.runtime.domain.history.ChatHistoryManager;
import me.reasonloop.runtime.domain.model.AgentRunResult;
import me.reasonloop.runtime.domain.model.AgentSnapshot;
import me.reasonloop.runtime.domain.model.AgentStatus;
import me.reasonloop.runtime.domain.model.AgentStep;
import me.reasonloop.runtime.domain.model.ApprovalDecision;
import me.reasonloop.runtime.domain.model.ApprovalOutcome;
import me.reasonloop.runtime.domain.model.BusEvent;
import me.reasonloop.runtime.domain.model.EventFilter;
import me.reasonloop.runtime.domain.model.EventSource;
import me.reasonloop.runtime.domain.model.EventTypes;
import me.reasonloop.runtime.domain.model.ExecutionMode;
import me.reasonloop.runtime.domain.model.ExtractorResult;
import me.reasonloop.runtime.domain.model.InputOutcome;
import me.reasonloop.runtime.domain.model.LlmRequest;
import me.reasonloop.runtime.domain.model.LlmResponse;
import me.reasonloop.runtime.domain.model.PendingEvent;
import me.reasonloop.runtime.domain.model.SubscriptionConfig;
import me.reasonloop.runtime.domain.model.ToolCall;
import me.reasonloop.runtime.domain.model.ToolDefinition;
import me.reasonloop.runtime.domain.model.ToolExecutionResult;
import me.reasonloop.runtime.domain.model.event.CollaborationRequest;
import me.reasonloop.runtime.domain.model.event.CollaborationResponse;
import me.reasonloop.runtime.domain.model.event.ErrorOccurred;
import me.reasonloop.runtime.domain.model.event.ExecutionModeChangeRequest;
import me.reasonloop.runtime.domain.model.event.ExecutionModeChangeResponse;
import me.reasonloop.runtime.domain.model.event.InputRequest;
import me.reasonloop.runtime.domain.prompt.PromptProcessor;
import me.reasonloop.runtime.domain.service.AgentEventPublisher;
import me.reasonloop.runtime.domain.service.InteractionService;
import me.reasonloop.runtime.domain.service.ToolApprovalPolicy;
import me.reasonloop.runtime.domain.service.ToolCallExecutionService;
import me.reasonloop.runtime.port.outbound.LlmPort;
import me.reasonloop.runtime.port.outbound.ToolPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One agent and its step loop.
 *
 * <p>
 * Lifecycle: {@code setup()} moves the agent from idle to initializing and
 * collects the tools it may call; {@code startWithUserInput} runs steps until
 * the model emits a stop signal, {@link #stop()} is called or the step limit
 * is reached, and then returns the agent to idle. A failing step leaves the
 * agent in error until {@link #reset()}.
 *
 * <p>
 * Each step: format the prompt from the history visible at that step, call
 * the model, extract thinking and reply, run the requested tools (asking for
 * approval where the execution mode demands it) and record everything in chat
 * history. Every phase is published on the event bus under the agent's
 * session.
 *
 * <p>
 * The execution mode is read once at the start of each step. Changes made
 * while a run is in progress, directly or through an
 * {@code execution_mode_change_request} event, take effect at the next step.
 * Once the agent has run in a session it keeps answering mode change requests
 * for that session between runs, applying them immediately, until
 * {@link #shutdown()}.
 *
 * @since 1.0
 */
@Slf4j
public class AgentLoop {

    static final String MODIFICATION_ARGUMENT = "modification";

    private final AgentLoopConfig config;
    private final EventBus eventBus;
    private final AgentEventPublisher events;
    private final InteractionService interactionService;
    private final ToolApprovalPolicy approvalPolicy;
    private final ToolCallExecutionService toolExecutionService;
    private final LlmPort llmPort;
    private final ToolPort toolPort;
    private final PromptProcessor promptProcessor;
    private final Clock clock;

    private final AgentStateMachine stateMachine = new AgentStateMachine();
    private final Map<String, ToolComponent> builtinTools = new LinkedHashMap<>();
    private final Map<String, ToolDefinition> toolDefinitions = new LinkedHashMap<>();
    private final List<AgentStep> steps = new CopyOnWriteArrayList<>();
    private final AtomicReference<ExecutionMode> pendingMode = new AtomicReference<>();

    private volatile ExecutionMode executionMode;
    private volatile boolean shouldStop;
    private volatile boolean resumeRequested;
    private volatile int currentStep;
    private volatile String sessionId;
    private volatile String modeSubscriptionId;
    private volatile String modeSubscriptionSessionId;
    private volatile String ownedSessionId;
    private volatile Instant sessionStartTime;
    private volatile Instant lastActiveTime;

    @SuppressWarnings("PMD.ExcessiveParameterList") // collaborators are wired by AgentFactory
    public AgentLoop(AgentLoopConfig config, EventBus eventBus, AgentEventPublisher events,
            InteractionService interactionService, ToolApprovalPolicy approvalPolicy,
            ToolCallExecutionService toolExecutionService, LlmPort llmPort, ToolPort toolPort,
            PromptProcessor promptProcessor, List<ToolComponent> builtinTools, Clock clock) {
        this.config = config;
        this.eventBus = eventBus;
        this.events = events;
        this.interactionService = interactionService;
        this.approvalPolicy = approvalPolicy;
        this.toolExecutionService = toolExecutionService;
        this.llmPort = llmPort;
        this.toolPort = toolPort;
        this.promptProcessor = promptProcessor;
        this.clock = clock;
        this.executionMode = config.getExecutionMode() != null ? config.getExecutionMode() : ExecutionMode.MANUAL;
        for (ToolComponent tool : builtinTools) {
            this.builtinTools.put(tool.getToolName(), tool);
        }
    }

    /**
     * Prepare the agent for a run: check the bus and collect tool definitions.
     * Built-in tools shadow external tools of the same name.
     */
    public void setup() {
        transition(AgentStatus.INITIALIZING, "setup");
        try {
            if (!eventBus.isRunning()) {
                throw new NotRunningException("set up agent " + getId());
            }
            Map<String, ToolDefinition> definitions = new LinkedHashMap<>();
            for (ToolComponent tool : builtinTools.values()) {
                definitions.put(tool.getToolName(), tool.getDefinition());
            }
            if (toolPort != null) {
                for (ToolDefinition definition : toolPort.listTools()) {
                    definitions.putIfAbsent(definition.getName(), definition);
                }
            }
            synchronized (toolDefinitions) {
                toolDefinitions.clear();
                toolDefinitions.putAll(definitions);
            }
            promptProcessor.setSystemPrompt(config.getSystemPrompt());
            log.info("[Agent] {} initialized with {} tools, mode: {}", getId(), definitions.size(),
                    executionMode.getValue());
        } catch (RuntimeException e) {
            log.error("[Agent] {} setup failed", getId(), e);
            transition(AgentStatus.ERROR, "setup failed: " + e.getMessage());
            publishSafely(() -> events.errorOccurred(sessionId, getId(), ErrorOccurred.INITIALIZATION_FAILURE, e,
                    Map.of()));
            throw e;
        }
    }

    /**
     * Run the loop for one user input. Sets the agent up first when it is idle.
     *
     * @param sessionId
     *            session to run in; when {@code null} a restored session is
     *            resumed, otherwise the agent reuses the bus session it opened
     *            for an earlier run or opens one. Sessions the agent opens are
     *            closed by {@link #shutdown()}; sessions passed in stay owned
     *            by the caller.
     * @throws StepFailureException
     *             if a step fails; the agent is then in error status
     */
    public AgentRunResult startWithUserInput(String userInput, int maxSteps, String sessionId) {
        if (userInput == null || userInput.isBlank()) {
            throw new ValidationException("User input is required");
        }
        if (maxSteps <= 0) {
            throw new ValidationException("Max steps must be positive: " + maxSteps);
        }
        AgentStatus status = stateMachine.current();
        if (status != AgentStatus.IDLE && status != AgentStatus.INITIALIZING) {
            throw new IllegalStateTransitionException(status, AgentStatus.RUNNING);
        }
        this.sessionId = resolveSession(sessionId);
        if (status == AgentStatus.IDLE) {
            setup();
        }

        prepareRun();
        promptProcessor.renderUserMessage(userInput, currentStep);
        subscribeToModeChanges();
        transition(AgentStatus.RUNNING, "start");
        log.info("[Agent] {} started in session {} (max steps: {})", getId(), this.sessionId, maxSteps);
        events.sessionStarted(this.sessionId, getId(), userInput, maxSteps);

        int firstStep = currentStep;
        AgentRunResult.StopReason stopReason;
        try {
            stopReason = runSteps(firstStep + maxSteps);
        } catch (StepFailureException e) {
            finishSession(firstStep);
            throw e;
        }
        String reason = stopReason.name().toLowerCase(Locale.ROOT);
        if (stateMachine.transitionIf(AgentStatus.RUNNING, AgentStatus.STOPPING)) {
            publishStateChange(AgentStatus.RUNNING, AgentStatus.STOPPING, reason);
        }
        transition(AgentStatus.IDLE, "finished: " + reason);
        finishSession(firstStep);
        log.info("[Agent] {} finished after {} steps ({})", getId(), currentStep - firstStep, stopReason);
        return new AgentRunResult(this.sessionId, currentStep - firstStep, currentStep, stopReason,
                promptProcessor.getFinalAnswer());
    }

    public AgentRunResult startWithUserInput(String userInput) {
        return startWithUserInput(userInput, config.getMaxSteps(), null);
    }

    /**
     * Request a cooperative stop. The step in progress completes; no further
     * step begins.
     */
    public void stop() {
        shouldStop = true;
        if (stateMachine.transitionIf(AgentStatus.RUNNING, AgentStatus.STOPPING)) {
            publishStateChange(AgentStatus.RUNNING, AgentStatus.STOPPING, "stop requested");
        }
        log.info("[Agent] {} stop requested", getId());
    }

    /**
     * Stop answering mode change requests and close the bus session the agent
     * opened itself, purging its event history. The agent must not be running.
     */
    public void shutdown() {
        AgentStatus status = stateMachine.current();
        if (status == AgentStatus.RUNNING || status == AgentStatus.STOPPING) {
            throw new IllegalStateTransitionException(status, AgentStatus.IDLE);
        }
        if (modeSubscriptionId != null) {
            eventBus.unsubscribe(modeSubscriptionId);
            modeSubscriptionId = null;
            modeSubscriptionSessionId = null;
        }
        String owned = ownedSessionId;
        ownedSessionId = null;
        if (owned != null && eventBus.getActiveSessions().contains(owned)) {
            eventBus.closeSession(owned);
        }
        log.info("[Agent] {} shut down", getId());
    }

    /**
     * Return to idle after an error and clear the stop flag.
     */
    public void reset() {
        if (stateMachine.current() == AgentStatus.IDLE) {
            shouldStop = false;
            return;
        }
        transition(AgentStatus.IDLE, "reset");
        shouldStop = false;
        resumeRequested = false;
        pendingMode.set(null);
        log.info("[Agent] {} reset", getId());
    }

    /**
     * Change the execution mode. While a run is in progress the new mode
     * applies from the next step on.
     */
    public void setExecutionMode(ExecutionMode mode) {
        if (mode == null) {
            throw new ValidationException("Execution mode is required");
        }
        AgentStatus status = stateMachine.current();
        if (status == AgentStatus.RUNNING || status == AgentStatus.STOPPING) {
            pendingMode.set(mode);
            log.info("[Agent] {} mode {} queued for next step", getId(), mode.getValue());
        } else {
            executionMode = mode;
            log.info("[Agent] {} mode set to {}", getId(), mode.getValue());
        }
    }

    /**
     * Ask the user for a value within the agent's session.
     */
    public CompletableFuture<InputOutcome> requestInput(InputRequest request) {
        return interactionService.requestInput(sessionId, request);
    }

    public CompletableFuture<CollaborationResponse> requestCollaboration(CollaborationRequest request) {
        return interactionService.requestCollaboration(sessionId, request);
    }

    public AgentSnapshot snapshot() {
        ChatHistoryManager history = promptProcessor.getChatHistoryManager();
        return AgentSnapshot.builder()
                .agentId(getId())
                .sessionId(sessionId)
                .currentStep(currentStep)
                .status(stateMachine.current())
                .executionMode(getExecutionMode())
                .steps(List.copyOf(steps))
                .chatHistory(history.getChatHistory())
                .excludedMessageIds(history.getExcludedIds())
                .sessionStartTime(sessionStartTime)
                .lastActiveTime(lastActiveTime)
                .build();
    }

    /**
     * Load a snapshot into an idle agent. The next run continues the restored
     * session from its current step.
     */
    public void restore(AgentSnapshot snapshot) {
        if (snapshot == null) {
            throw new ValidationException("Snapshot is required");
        }
        AgentStatus status = stateMachine.current();
        if (status != AgentStatus.IDLE) {
            throw new IllegalStateTransitionException(status, AgentStatus.IDLE);
        }
        promptProcessor.reset();
        ChatHistoryManager history = promptProcessor.getChatHistoryManager();
        if (snapshot.getChatHistory() != null) {
            snapshot.getChatHistory().forEach(history::addCompleteMessage);
        }
        if (snapshot.getExcludedMessageIds() != null && !snapshot.getExcludedMessageIds().isEmpty()) {
            history.excludeChatHistoryBatch(snapshot.getExcludedMessageIds());
        }
        steps.clear();
        if (snapshot.getSteps() != null) {
            steps.addAll(snapshot.getSteps());
        }
        this.sessionId = snapshot.getSessionId();
        this.currentStep = snapshot.getCurrentStep();
        if (snapshot.getExecutionMode() != null) {
            this.executionMode = snapshot.getExecutionMode();
        }
        this.sessionStartTime = snapshot.getSessionStartTime();
        this.lastActiveTime = snapshot.getLastActiveTime();
        this.resumeRequested = true;
        log.info("[Agent] {} restored session {} at step {}", getId(), sessionId, currentStep);
    }

    public String getId() {
        return config.getAgentId();
    }

    public String getName() {
        return config.getName();
    }

    public AgentStatus getStatus() {
        return stateMachine.current();
    }

    public ExecutionMode getExecutionMode() {
        return executionMode;
    }

    public ExecutionMode getPendingExecutionMode() {
        return pendingMode.get();
    }

    public boolean isStopRequested() {
        return shouldStop;
    }

    public int getCurrentStep() {
        return currentStep;
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<AgentStep> getSteps() {
        return List.copyOf(steps);
    }

    public List<ToolDefinition> getActiveTools() {
        synchronized (toolDefinitions) {
            return List.copyOf(toolDefinitions.values());
        }
    }

    public PromptProcessor getPromptProcessor() {
        return promptProcessor;
    }

    public ChatHistoryManager getChatHistoryManager() {
        return promptProcessor.getChatHistoryManager();
    }

    private void prepareRun() {
        shouldStop = false;
        if (resumeRequested) {
            resumeRequested = false;
        } else {
            currentStep = 0;
            steps.clear();
            promptProcessor.reset();
            sessionStartTime = clock.instant();
        }
        lastActiveTime = clock.instant();
    }

    private AgentRunResult.StopReason runSteps(int stepLimit) {
        while (currentStep < stepLimit) {
            applyPendingMode();
            if (shouldStop) {
                log.info("[Agent] {} stopping before step {}", getId(), currentStep);
                return AgentRunResult.StopReason.STOPPED;
            }
            int stepIndex = currentStep;
            ExecutionMode stepMode = executionMode;
            try {
                AgentStep step = processStep(stepIndex, stepMode);
                steps.add(step);
                currentStep = stepIndex + 1;
                lastActiveTime = clock.instant();
                events.stepCompleted(sessionId, getId(), stepIndex);
            } catch (RuntimeException e) {
                Throwable cause = unwrap(e);
                failStep(stepIndex, cause);
                throw new StepFailureException(stepIndex, cause);
            }

            if (promptProcessor.isStopSignalReceived()) {
                log.info("[Agent] {} received stop signal at step {}", getId(), stepIndex);
                return AgentRunResult.StopReason.STOP_SIGNAL;
            }
        }
        return AgentRunResult.StopReason.MAX_STEPS;
    }

    private AgentStep processStep(int stepIndex, ExecutionMode mode) {
        log.debug("[Agent] {} step {} (mode: {})", getId(), stepIndex, mode.getValue());
        events.stepStarted(sessionId, getId(), stepIndex);

        String prompt = promptProcessor.formatPrompt(stepIndex);
        LlmResponse response = llmPort.callAsync(LlmRequest.builder()
                .agentId(getId())
                .sessionId(sessionId)
                .stepIndex(stepIndex)
                .prompt(prompt)
                .tools(getActiveTools())
                .build()).join();
        if (response == null) {
            throw new IllegalStateException("Model returned no response");
        }

        ExtractorResult extracted = promptProcessor.extract(response.getText());
        if (extracted.hasThinking()) {
            events.thinking(sessionId, stepIndex, extracted);
        }
        if (extracted.response() != null) {
            events.reply(sessionId, extracted.response(), extracted.isStopRequested());
        }

        List<ToolCall> toolCalls = response.hasToolCalls() ? List.copyOf(response.getToolCalls()) : List.of();
        List<ToolExecutionResult> results = new ArrayList<>(toolCalls.size());
        for (ToolCall toolCall : toolCalls) {
            results.add(executeToolCall(toolCall, mode));
        }

        AgentStep step = AgentStep.builder()
                .stepIndex(stepIndex)
                .prompt(prompt)
                .rawText(response.getText())
                .extractorResult(extracted)
                .toolCalls(toolCalls)
                .toolExecutionResults(List.copyOf(results))
                .executionMode(mode)
                .build();
        promptProcessor.processStepResult(step);
        return step;
    }

    private ToolExecutionResult executeToolCall(ToolCall toolCall, ExecutionMode mode) {
        ToolCall effective = toolCall.getCallId() != null ? toolCall
                : toolCall.toBuilder().callId(UUID.randomUUID().toString()).build();
        String toolName = effective.getName();

        if (toolName != null && !toolName.isBlank() && !builtinTools.containsKey(toolName)) {
            ToolDefinition definition;
            synchronized (toolDefinitions) {
                definition = toolDefinitions.get(toolName);
            }
            if (approvalPolicy.requiresApproval(mode, effective, definition)) {
                ApprovalOutcome outcome = interactionService
                        .requestApproval(sessionId, approvalPolicy.buildRequest(effective))
                        .join();
                if (!outcome.isApproved()) {
                    String reason = outcome.timedOut() ? "Approval timed out, action rejected" : "Rejected by user";
                    log.info("[Agent] {} tool {} not executed: {}", getId(), toolName, reason);
                    ToolExecutionResult rejected = ToolExecutionResult.failed(effective, reason, 0);
                    events.toolResult(sessionId, rejected);
                    return rejected;
                }
                if (outcome.decision() == ApprovalDecision.MODIFY && outcome.modification() != null) {
                    effective = effective.withArgument(MODIFICATION_ARGUMENT, outcome.modification());
                }
            }
        }

        ToolExecutionResult result = toolExecutionService.execute(effective, builtinTools, toolPort);
        events.toolResult(sessionId, result);
        return result;
    }

    private void applyPendingMode() {
        ExecutionMode next = pendingMode.getAndSet(null);
        if (next != null && next != executionMode) {
            log.info("[Agent] {} mode {} -> {} at step {}", getId(), executionMode.getValue(), next.getValue(),
                    currentStep);
            executionMode = next;
        }
    }

    private String resolveSession(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        if (resumeRequested && sessionId != null) {
            return sessionId;
        }
        String owned = ownedSessionId;
        if (owned != null && eventBus.getActiveSessions().contains(owned)) {
            return owned;
        }
        ownedSessionId = eventBus.createSession();
        return ownedSessionId;
    }

    // Stays registered between runs so an idle agent still answers; replaced
    // when the session changes or the bus dropped it on restart.
    private void subscribeToModeChanges() {
        String current = modeSubscriptionId;
        if (current != null && sessionId.equals(modeSubscriptionSessionId) && isSubscribed(current)) {
            return;
        }
        if (current != null) {
            eventBus.unsubscribe(current);
        }
        modeSubscriptionId = eventBus.subscribe(EventTypes.EXECUTION_MODE_CHANGE_REQUEST, this::onModeChangeRequest,
                SubscriptionConfig.filtered(EventFilter.forSession(sessionId)));
        modeSubscriptionSessionId = sessionId;
    }

    private boolean isSubscribed(String subscriptionId) {
        return eventBus.getActiveSubscriptions().stream()
                .anyMatch(subscription -> subscriptionId.equals(subscription.getId()));
    }

    private void onModeChangeRequest(BusEvent event) {
        ExecutionModeChangeRequest request = event.payloadAs(ExecutionModeChangeRequest.class);
        if (request == null) {
            return;
        }
        ExecutionModeChangeResponse response;
        if (request.requestId() == null || request.requestId().isBlank()) {
            response = ExecutionModeChangeResponse.rejected(request.requestId(), executionMode,
                    "Request id is required");
        } else if (request.toMode() == null) {
            response = ExecutionModeChangeResponse.rejected(request.requestId(), executionMode,
                    "Target mode is required");
        } else {
            setExecutionMode(request.toMode());
            response = ExecutionModeChangeResponse.accepted(request.requestId(), request.toMode());
        }
        eventBus.publish(PendingEvent.of(EventSource.AGENT, event.sessionId(), response));
    }

    private void failStep(int stepIndex, Throwable cause) {
        log.error("[Agent] {} step {} failed", getId(), stepIndex, cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        promptProcessor.renderError(message, stepIndex);
        transition(AgentStatus.ERROR, "step " + stepIndex + " failed");
        publishSafely(() -> events.stepFailed(sessionId, getId(), stepIndex, message));
        publishSafely(() -> events.errorOccurred(sessionId, getId(), ErrorOccurred.STEP_FAILURE, cause,
                Map.of("stepIndex", stepIndex)));
    }

    private void finishSession(int firstStep) {
        lastActiveTime = clock.instant();
        publishSafely(() -> events.sessionEnded(sessionId, getId(), currentStep - firstStep));
    }

    private void transition(AgentStatus target, String reason) {
        AgentStatus previous = stateMachine.transition(target);
        log.info("[Agent] {} {} -> {} ({})", getId(), previous.getValue(), target.getValue(), reason);
        publishStateChange(previous, target, reason);
    }

    private void publishStateChange(AgentStatus from, AgentStatus to, String reason) {
        publishSafely(() -> events.stateChanged(sessionId, getId(), from, to, reason, currentStep));
    }

    private void publishSafely(Runnable publication) {
        try {
            publication.run();
        } catch (NotRunningException e) {
            log.warn("[Agent] {} event not published: {}", getId(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
