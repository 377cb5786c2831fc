package me.reasonloop.runtime.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.reasonloop.runtime.domain.bus.EventBus;
import me.reasonloop.runtime.domain.model.AgentStatus;
import me.reasonloop.runtime.domain.model.ExecutionMode;
import me.reasonloop.runtime.domain.model.MessageType;
import me.reasonloop.runtime.domain.service.AgentEventPublisher;
import me.reasonloop.runtime.domain.service.InteractionService;
import me.reasonloop.runtime.domain.service.ToolApprovalPolicy;
import me.reasonloop.runtime.domain.service.ToolCallExecutionService;
import me.reasonloop.runtime.infrastructure.config.AgentProperties;
import me.reasonloop.runtime.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AgentFactoryTest {

    private AgentProperties properties;
    private AgentFactory factory;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getAgent().setMaxSteps(7);
        properties.getAgent().setExecutionMode(ExecutionMode.SUPERVISED);
        properties.getChatHistory().getKeepSteps().put(MessageType.PLAN, 1);
        EventBus eventBus = mock(EventBus.class);
        factory = new AgentFactory(eventBus, new AgentEventPublisher(eventBus),
                new InteractionService(eventBus, properties), new ToolApprovalPolicy(properties),
                new ToolCallExecutionService(properties), properties, new ObjectMapper(), Clock.systemUTC());
    }

    @Test
    void shouldBuildDefaultConfigFromProperties() {
        AgentLoopConfig config = factory.defaultConfig("planner");

        assertEquals("planner", config.getName());
        assertEquals(7, config.getMaxSteps());
        assertEquals(ExecutionMode.SUPERVISED, config.getExecutionMode());
        assertNotNull(config.getAgentId());
        assertEquals(1, config.getChatHistoryConfig().keepSteps(MessageType.PLAN).getAsInt());
        assertEquals(100, config.getChatHistoryConfig().keepSteps(MessageType.MESSAGE).getAsInt());
    }

    @Test
    void shouldCreateIdleAgentWithOwnHistory() {
        LlmPort llm = mock(LlmPort.class);

        AgentLoop first = factory.create("a", llm, null);
        AgentLoop second = factory.create("b", llm, null);

        assertEquals(AgentStatus.IDLE, first.getStatus());
        assertEquals(ExecutionMode.SUPERVISED, first.getExecutionMode());
        assertNotEquals(first.getId(), second.getId());
        assertNotSame(first.getChatHistoryManager(), second.getChatHistoryManager());
        assertEquals(1, first.getChatHistoryManager().getConfig().keepSteps(MessageType.PLAN).getAsInt());
    }

    @Test
    void shouldAssignIdWhenMissing() {
        AgentLoopConfig config = AgentLoopConfig.builder().name("anonymous").build();

        AgentLoop agent = factory.create(config, mock(LlmPort.class), null);

        assertNotNull(agent.getId());
        assertEquals("anonymous", agent.getName());
        assertEquals(config.getAgentId(), agent.getId());
    }
}
