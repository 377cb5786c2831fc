package me.reasonloop.runtime.domain.service;

import me.reasonloop.runtime.domain.component.ToolComponent;
import me.reasonloop.runtime.domain.model.ToolCall;
import me.reasonloop.runtime.domain.model.ToolExecutionResult;
import me.reasonloop.runtime.domain.model.ToolExecutionStatus;
import me.reasonloop.runtime.domain.model.ToolResult;
import me.reasonloop.runtime.infrastructure.config.AgentProperties;
import me.reasonloop.runtime.port.outbound.ToolPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolCallExecutionServiceTest {

    private static final String TOOL_NAME = "test_tool";
    private static final String TOOL_CALL_ID = "call_123";

    private ToolComponent toolComponent;
    private ToolPort toolPort;
    private ToolCallExecutionService service;

    @BeforeEach
    void setUp() {
        toolComponent = mock(ToolComponent.class);
        toolPort = mock(ToolPort.class);
        when(toolComponent.isEnabled()).thenReturn(true);

        AgentProperties properties = new AgentProperties();
        properties.getAgent().setToolTimeout(Duration.ofMillis(200));
        service = new ToolCallExecutionService(properties);
    }

    private static ToolCall call(String name) {
        return ToolCall.builder().callId(TOOL_CALL_ID).name(name).arguments(Map.of("key", "value")).build();
    }

    @Test
    void shouldExecuteBuiltinTool() {
        when(toolComponent.execute(any())).thenReturn(CompletableFuture.completedFuture(ToolResult.success("ok")));

        ToolExecutionResult result = service.execute(call(TOOL_NAME), Map.of(TOOL_NAME, toolComponent), toolPort);

        assertTrue(result.isSuccess());
        assertEquals(TOOL_CALL_ID, result.getCallId());
        assertEquals("ok", result.getMessage());
        verify(toolPort, never()).execute(any());
    }

    @Test
    void shouldDelegateUnknownBuiltinToToolPort() {
        when(toolPort.execute(any())).thenReturn(CompletableFuture.completedFuture(
                ToolResult.success("listed", Map.of("files", 3))));

        ToolExecutionResult result = service.execute(call("shell"), Map.of(), toolPort);

        assertTrue(result.isSuccess());
        assertEquals(Map.of("files", 3), result.getResult());
    }

    @Test
    void shouldFailUnknownToolWithoutPort() {
        ToolExecutionResult result = service.execute(call("missing"), Map.of(TOOL_NAME, toolComponent), null);

        assertEquals(ToolExecutionStatus.FAILED, result.getStatus());
        assertTrue(result.getMessage().startsWith("Unknown tool: missing"));
    }

    @Test
    void shouldMapToolFailureToFailedResult() {
        when(toolComponent.execute(any())).thenReturn(CompletableFuture.completedFuture(ToolResult.failure("bad")));

        ToolExecutionResult result = service.execute(call(TOOL_NAME), Map.of(TOOL_NAME, toolComponent), null);

        assertFalse(result.isSuccess());
        assertEquals("bad", result.getMessage());
    }

    @Test
    void shouldMapExceptionsToFailedResult() {
        when(toolComponent.execute(any())).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        ToolExecutionResult result = service.execute(call(TOOL_NAME), Map.of(TOOL_NAME, toolComponent), null);

        assertFalse(result.isSuccess());
        assertEquals("Tool execution failed: disk full", result.getMessage());
    }

    @Test
    void shouldTimeOutSlowTools() {
        when(toolComponent.execute(any())).thenReturn(new CompletableFuture<>());

        ToolExecutionResult result = service.execute(call(TOOL_NAME), Map.of(TOOL_NAME, toolComponent), null);

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().startsWith("Tool execution timed out"));
    }

    @Test
    void shouldRefuseDisabledTool() {
        when(toolComponent.isEnabled()).thenReturn(false);

        ToolExecutionResult result = service.execute(call(TOOL_NAME), Map.of(TOOL_NAME, toolComponent), null);

        assertEquals("Tool is disabled: " + TOOL_NAME, result.getMessage());
        verify(toolComponent, never()).execute(any());
    }

    @Test
    void shouldSanitizeLeakedTokensInToolName() {
        when(toolComponent.execute(any())).thenReturn(CompletableFuture.completedFuture(ToolResult.success("ok")));

        ToolExecutionResult result = service.execute(call(TOOL_NAME + "<|channel|>commentary"),
                Map.of(TOOL_NAME, toolComponent), null);

        assertTrue(result.isSuccess());
    }
}
