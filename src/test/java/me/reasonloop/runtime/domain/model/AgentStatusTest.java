package me.reasonloop.runtime.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AgentStatusTest {

    @Test
    void shouldAllowOnlyDocumentedTransitions() {
        assertEquals(Set.of(AgentStatus.INITIALIZING), AgentStatus.IDLE.allowedTargets());
        assertEquals(Set.of(AgentStatus.RUNNING, AgentStatus.ERROR), AgentStatus.INITIALIZING.allowedTargets());
        assertEquals(Set.of(AgentStatus.STOPPING, AgentStatus.ERROR), AgentStatus.RUNNING.allowedTargets());
        assertEquals(Set.of(AgentStatus.IDLE, AgentStatus.ERROR), AgentStatus.STOPPING.allowedTargets());
        assertEquals(Set.of(AgentStatus.IDLE), AgentStatus.ERROR.allowedTargets());
    }

    @Test
    void shouldNotSkipInitialization() {
        assertFalse(AgentStatus.IDLE.canTransitionTo(AgentStatus.RUNNING));
        assertFalse(AgentStatus.ERROR.canTransitionTo(AgentStatus.RUNNING));
        assertFalse(AgentStatus.RUNNING.canTransitionTo(AgentStatus.IDLE));
    }

    @Test
    void shouldExposeLowercaseValue() {
        assertEquals("stopping", AgentStatus.STOPPING.getValue());
    }
}
