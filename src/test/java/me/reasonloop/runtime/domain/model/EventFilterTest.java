package me.reasonloop.runtime.domain.model;

import me.reasonloop.runtime.domain.model.event.UserMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EventFilterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private static BusEvent event(String sessionId, EventSource source, Instant timestamp) {
        return BusEvent.builder()
                .id("evt-1")
                .timestamp(timestamp)
                .source(source)
                .sessionId(sessionId)
                .payload(new UserMessage("hello", "text"))
                .build();
    }

    @Test
    void shouldMatchEverythingWhenEmpty() {
        assertTrue(EventFilter.any().matches(event("s1", EventSource.USER, NOW)));
    }

    @Test
    void shouldRequireEveryConditionToHold() {
        EventFilter filter = EventFilter.builder()
                .eventTypes(Set.of(EventTypes.USER_MESSAGE))
                .sources(Set.of(EventSource.USER))
                .sessionId("s1")
                .build();

        assertTrue(filter.matches(event("s1", EventSource.USER, NOW)));
        assertFalse(filter.matches(event("s2", EventSource.USER, NOW)));
        assertFalse(filter.matches(event("s1", EventSource.AGENT, NOW)));
        assertFalse(EventFilter.forTypes(Set.of(EventTypes.AGENT_REPLY)).matches(event("s1", EventSource.USER, NOW)));
    }

    @Test
    void shouldTreatTimeBoundsAsInclusive() {
        EventFilter filter = EventFilter.builder()
                .after(NOW)
                .before(NOW.plusSeconds(10))
                .build();

        assertTrue(filter.matches(event("s1", EventSource.USER, NOW)));
        assertTrue(filter.matches(event("s1", EventSource.USER, NOW.plusSeconds(10))));
        assertFalse(filter.matches(event("s1", EventSource.USER, NOW.minusMillis(1))));
        assertFalse(filter.matches(event("s1", EventSource.USER, NOW.plusSeconds(11))));
    }
}
