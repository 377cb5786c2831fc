package me.reasonloop.runtime.infrastructure.event;

import me.reasonloop.runtime.domain.exception.NotFoundException;
import me.reasonloop.runtime.domain.exception.NotRunningException;
import me.reasonloop.runtime.domain.exception.ValidationException;
import me.reasonloop.runtime.domain.model.BusEvent;
import me.reasonloop.runtime.domain.model.EventBusStats;
import me.reasonloop.runtime.domain.model.EventFilter;
import me.reasonloop.runtime.domain.model.EventHistoryEntry;
import me.reasonloop.runtime.domain.model.EventSource;
import me.reasonloop.runtime.domain.model.EventTypes;
import me.reasonloop.runtime.domain.model.InputType;
import me.reasonloop.runtime.domain.model.PendingEvent;
import me.reasonloop.runtime.domain.model.SubscriptionConfig;
import me.reasonloop.runtime.domain.model.event.ApprovalRequest;
import me.reasonloop.runtime.domain.model.event.InputRequest;
import me.reasonloop.runtime.domain.model.event.UserMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventBusTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String SESSION_A = "session-a";
    private static final String SESSION_B = "session-b";

    private ExecutorService executor;
    private InMemoryEventBus bus;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        bus = newBus(100, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        bus.stop();
        executor.shutdownNow();
    }

    private InMemoryEventBus newBus(int historySize, Clock clock) {
        InMemoryEventBus created = new InMemoryEventBus(historySize, 100, executor, clock);
        created.start();
        return created;
    }

    private static PendingEvent message(String sessionId, String content) {
        return PendingEvent.of(EventSource.USER, sessionId, new UserMessage(content, "text"));
    }

    private static PendingEvent approvalRequest(String sessionId) {
        return PendingEvent.of(EventSource.AGENT, sessionId, ApprovalRequest.builder()
                .requestId("req-1")
                .description("Run command: ls")
                .build());
    }

    private static PendingEvent inputRequest(String sessionId) {
        return PendingEvent.of(EventSource.AGENT, sessionId, InputRequest.builder()
                .requestId("req-2")
                .prompt("Name?")
                .inputType(InputType.TEXT)
                .build());
    }

    private static String content(EventHistoryEntry entry) {
        return entry.getEvent().payloadAs(UserMessage.class).content();
    }

    @Test
    void shouldKeepOnlyMostRecentEventsWhenHistoryIsFull() {
        bus = newBus(2, Clock.fixed(NOW, ZoneOffset.UTC));

        bus.publish(message(SESSION_A, "E1")).join();
        bus.publish(message(SESSION_A, "E2")).join();
        bus.publish(message(SESSION_A, "E3")).join();

        List<EventHistoryEntry> history = bus.getEventHistory();
        assertEquals(2, history.size());
        assertEquals("E3", content(history.get(0)));
        assertEquals("E2", content(history.get(1)));
    }

    @Test
    void shouldNeverExceedHistoryBoundForAnyPublishCount() {
        bus = newBus(5, Clock.fixed(NOW, ZoneOffset.UTC));

        for (int i = 0; i < 23; i++) {
            bus.publish(message(SESSION_A, "E" + i)).join();
            assertTrue(bus.getEventHistory(null, 1000).size() <= 5);
        }
        List<EventHistoryEntry> history = bus.getEventHistory(null, 1000);
        assertEquals(List.of("E22", "E21", "E20", "E19", "E18"), history.stream().map(InMemoryEventBusTest::content)
                .toList());
    }

    @Test
    void shouldDeliverOnlySubscribedEventTypes() {
        AtomicInteger invocations = new AtomicInteger();
        bus.subscribe(EventTypes.APPROVAL_REQUEST, event -> invocations.incrementAndGet());

        bus.publish(inputRequest(SESSION_A)).join();
        assertEquals(0, invocations.get());

        bus.publish(approvalRequest(SESSION_A)).join();
        assertEquals(1, invocations.get());
    }

    @Test
    void shouldInvokeEachMatchingHandlerExactlyOnce() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        bus.subscribe(EventTypes.USER_MESSAGE, event -> first.incrementAndGet());
        bus.subscribe(Set.of(EventTypes.USER_MESSAGE, EventTypes.AGENT_REPLY), event -> second.incrementAndGet(),
                SubscriptionConfig.defaults());

        bus.publish(message(SESSION_A, "hello")).join();

        assertEquals(1, first.get());
        assertEquals(1, second.get());
    }

    @Test
    void shouldIsolateFailingHandler() {
        AtomicInteger healthy = new AtomicInteger();
        bus.subscribe(EventTypes.USER_MESSAGE, event -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(EventTypes.USER_MESSAGE, event -> healthy.incrementAndGet());

        BusEvent published = bus.publish(message(SESSION_A, "hello")).join();

        assertNotNull(published);
        assertEquals(1, healthy.get());
        EventHistoryEntry entry = bus.getEventHistory().get(0);
        assertTrue(entry.isProcessed());
        assertEquals(List.of("boom"), entry.getErrors());
        EventBusStats stats = bus.getStats();
        assertEquals(1, stats.totalHandlerErrors());
        assertEquals(100.0, stats.errorRate(), 0.001);
    }

    @Test
    void shouldRunHandlersOfOneEventConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        AtomicInteger completed = new AtomicInteger();
        for (int i = 0; i < 2; i++) {
            bus.subscribe(EventTypes.USER_MESSAGE, event -> {
                bothStarted.countDown();
                if (bothStarted.await(2, TimeUnit.SECONDS)) {
                    completed.incrementAndGet();
                }
            });
        }

        bus.publish(message(SESSION_A, "parallel")).join();

        assertEquals(2, completed.get());
    }

    @Test
    void shouldResolvePublishOnlyAfterHandlersSettled() {
        AtomicInteger finished = new AtomicInteger();
        bus.subscribe(EventTypes.USER_MESSAGE, event -> {
            Thread.sleep(50);
            finished.incrementAndGet();
        });

        bus.publish(message(SESSION_A, "slow")).join();

        assertEquals(1, finished.get());
    }

    @Test
    void shouldAssignUniqueIdsAndBusTimestamps() {
        BusEvent first = bus.publish(message(SESSION_A, "one")).join();
        BusEvent second = bus.publish(message(SESSION_A, "two")).join();

        assertNotEquals(first.id(), second.id());
        assertEquals(NOW, first.timestamp());
        assertEquals(EventSource.USER, first.source());
        assertEquals(EventTypes.USER_MESSAGE, first.type());
    }

    @Test
    void shouldKeepTimestampsNonDecreasingWhenClockGoesBack() {
        MutableClock clock = new MutableClock(NOW);
        bus = newBus(10, clock);

        bus.publish(message(SESSION_A, "first")).join();
        clock.set(NOW.minusSeconds(30));
        BusEvent second = bus.publish(message(SESSION_A, "second")).join();

        assertEquals(NOW, second.timestamp());
        assertEquals("second", content(bus.getEventHistory().get(0)));
    }

    @Test
    void shouldDefaultSessionWhenAbsent() {
        BusEvent event = bus.publish(message(null, "no session")).join();

        assertEquals(PendingEvent.DEFAULT_SESSION, event.sessionId());
    }

    @Test
    void shouldRejectMalformedEvents() {
        assertThrows(ValidationException.class, () -> bus.publish(null));
        assertThrows(ValidationException.class, () -> bus.publish(PendingEvent.of(EventSource.USER, SESSION_A, null)));
        assertThrows(ValidationException.class,
                () -> bus.publish(PendingEvent.of(null, SESSION_A, new UserMessage("x", "text"))));
    }

    @Test
    void shouldRejectPublishAndSubscribeWhenStopped() {
        bus.stop();

        assertFalse(bus.isRunning());
        assertThrows(NotRunningException.class, () -> bus.publish(message(SESSION_A, "late")));
        assertThrows(NotRunningException.class, () -> bus.subscribe(EventTypes.USER_MESSAGE, event -> {
        }));
    }

    @Test
    void shouldDropSubscriptionsAndSessionsOnStopButKeepHistory() {
        bus.subscribe(EventTypes.USER_MESSAGE, event -> {
        });
        bus.createSession();
        bus.publish(message(SESSION_A, "kept")).join();

        bus.stop();
        bus.stop();

        assertTrue(bus.getActiveSubscriptions().isEmpty());
        assertTrue(bus.getActiveSessions().isEmpty());
        assertEquals(1, bus.getEventHistory().size());

        bus.start();
        bus.start();
        assertTrue(bus.isRunning());
    }

    @Test
    void shouldStopDeliveringAfterUnsubscribe() {
        AtomicInteger invocations = new AtomicInteger();
        String id = bus.subscribe(EventTypes.USER_MESSAGE, event -> invocations.incrementAndGet());

        assertTrue(bus.unsubscribe(id));
        assertFalse(bus.unsubscribe(id));
        bus.publish(message(SESSION_A, "after")).join();

        assertEquals(0, invocations.get());
    }

    @Test
    void shouldApplySubscriptionFilter() {
        AtomicInteger invocations = new AtomicInteger();
        bus.subscribe(EventTypes.USER_MESSAGE, event -> invocations.incrementAndGet(),
                SubscriptionConfig.filtered(EventFilter.forSession(SESSION_B)));

        bus.publish(message(SESSION_A, "other")).join();
        bus.publish(message(SESSION_B, "mine")).join();

        assertEquals(1, invocations.get());
    }

    @Test
    void shouldRemoveCappedSubscriptionAfterMaxEvents() {
        AtomicInteger invocations = new AtomicInteger();
        bus.subscribe(EventTypes.USER_MESSAGE, event -> invocations.incrementAndGet(),
                SubscriptionConfig.builder().maxEvents(2).build());
        bus.subscribe(EventTypes.USER_MESSAGE, event -> invocations.incrementAndGet(),
                SubscriptionConfig.builder().maxEvents(1).persistent(true).build());

        for (int i = 0; i < 4; i++) {
            bus.publish(message(SESSION_A, "m" + i)).join();
        }

        assertEquals(2 + 4, invocations.get());
        assertEquals(1, bus.getActiveSubscriptions().size());
    }

    @Test
    void shouldFilterHistoryBySessionSourceAndTime() {
        MutableClock clock = new MutableClock(NOW);
        bus = newBus(10, clock);
        bus.publish(message(SESSION_A, "a1")).join();
        clock.set(NOW.plusSeconds(10));
        bus.publish(message(SESSION_B, "b1")).join();
        clock.set(NOW.plusSeconds(20));
        bus.publish(approvalRequest(SESSION_A)).join();

        assertEquals(2, bus.getEventHistory(EventFilter.forSession(SESSION_A)).size());
        assertEquals(1, bus.getEventHistory(EventFilter.builder().sources(Set.of(EventSource.AGENT)).build()).size());
        List<EventHistoryEntry> window = bus.getEventHistory(EventFilter.builder()
                .after(NOW.plusSeconds(5))
                .before(NOW.plusSeconds(15))
                .build());
        assertEquals(1, window.size());
        assertEquals("b1", content(window.get(0)));
        assertEquals(1, bus.getEventHistory(null, 1).size());
        assertThrows(ValidationException.class, () -> bus.getEventHistory(null, -1));
    }

    @Test
    void shouldClearMatchingHistory() {
        bus.publish(message(SESSION_A, "a")).join();
        bus.publish(message(SESSION_B, "b")).join();

        assertEquals(1, bus.clearEventHistory(EventFilter.forSession(SESSION_A)));
        assertEquals(1, bus.getEventHistory().size());
        assertEquals(1, bus.clearEventHistory(null));
        assertTrue(bus.getEventHistory().isEmpty());
    }

    @Test
    void shouldPurgeSessionHistoryOnClose() {
        String session = bus.createSession();
        bus.publish(message(session, "one")).join();
        bus.publish(message(session, "two")).join();
        bus.publish(message(SESSION_B, "other")).join();

        assertTrue(bus.getActiveSessions().contains(session));
        bus.closeSession(session);

        assertTrue(bus.getEventHistory(EventFilter.forSession(session)).isEmpty());
        assertEquals(1, bus.getEventHistory().size());
        assertFalse(bus.getActiveSessions().contains(session));
    }

    @Test
    void shouldFailClosingUnknownSession() {
        NotFoundException error = assertThrows(NotFoundException.class, () -> bus.closeSession("missing"));

        assertEquals("missing", error.getIdentifier());
    }

    @Test
    void shouldReportStats() {
        bus.subscribe(EventTypes.USER_MESSAGE, event -> {
        });
        String removed = bus.subscribe(EventTypes.APPROVAL_REQUEST, event -> {
        });
        assertTrue(bus.unsubscribe(removed));
        bus.createSession();
        bus.publish(message(SESSION_A, "one")).join();
        bus.publish(message(SESSION_A, "two")).join();
        bus.publish(approvalRequest(SESSION_A)).join();

        EventBusStats stats = bus.getStats();

        assertEquals(3, stats.totalEvents());
        assertEquals(2, stats.eventsByType().get(EventTypes.USER_MESSAGE));
        assertEquals(1, stats.eventsByType().get(EventTypes.APPROVAL_REQUEST));
        assertEquals(2, stats.totalSubscriptions());
        assertEquals(1, stats.activeSubscriptions());
        assertEquals(1, stats.activeSessions());
        assertEquals(0.0, stats.errorRate(), 0.001);
        assertEquals(3, stats.totalPublished());
        assertTrue(stats.averageProcessingTimeMs() >= 0.0);
    }

    @Test
    void shouldAllowHandlersToPublish() {
        Set<String> seen = new HashSet<>();
        bus.subscribe(EventTypes.USER_MESSAGE, event -> bus.publish(approvalRequest(event.sessionId())).join());
        bus.subscribe(EventTypes.APPROVAL_REQUEST, event -> {
            synchronized (seen) {
                seen.add(event.sessionId());
            }
        });

        bus.publish(message(SESSION_A, "trigger")).join();

        synchronized (seen) {
            assertEquals(Set.of(SESSION_A), seen);
        }
    }

    @Test
    void shouldRejectInvalidSubscriptions() {
        assertThrows(ValidationException.class, () -> bus.subscribe(Set.of(), event -> {
        }, SubscriptionConfig.defaults()));
        assertThrows(ValidationException.class, () -> bus.subscribe(EventTypes.USER_MESSAGE, null));
    }

    @Test
    void shouldRejectInvalidConstruction() {
        assertThrows(ValidationException.class,
                () -> new InMemoryEventBus(0, 10, executor, Clock.systemUTC()));
        assertThrows(ValidationException.class,
                () -> new InMemoryEventBus(10, 0, executor, Clock.systemUTC()));
    }

    private static final class MutableClock extends Clock {

        private volatile Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        void set(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
