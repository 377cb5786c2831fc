package me.reasonloop.runtime.infrastructure.event;

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
import me.reasonloop.runtime.domain.bus.EventHandler;
import me.reasonloop.runtime.domain.bus.Subscription;
import me.reasonloop.runtime.domain.exception.NotFoundException;
import me.reasonloop.runtime.domain.exception.NotRunningException;
import me.reasonloop.runtime.domain.exception.ValidationException;
import me.reasonloop.runtime.domain.model.BusEvent;
import me.reasonloop.runtime.domain.model.EventBusStats;
import me.reasonloop.runtime.domain.model.EventFilter;
import me.reasonloop.runtime.domain.model.EventHistoryEntry;
import me.reasonloop.runtime.domain.model.PendingEvent;
import me.reasonloop.runtime.domain.model.SubscriptionConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Event bus keeping subscriptions, sessions and a bounded history in memory.
 *
 * <p>
 * A single monitor guards subscriptions, sessions, history and counters. It
 * is held while an event is stamped, appended and matched, and released
 * before handlers run, so handlers may publish or subscribe themselves.
 * Handlers of one event run concurrently on the handler executor.
 *
 * <p>
 * History is a FIFO of at most {@code maxHistorySize} entries; the oldest
 * entry is evicted first. Timestamps never decrease in publish order, so
 * iterating the FIFO backwards yields newest-first order with the publish
 * sequence as tie-breaker.
 *
 * @since 1.0
 */
@Slf4j
public class InMemoryEventBus implements EventBus {

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final Object lock = new Object();
    private final int maxHistorySize;
    private final int statsWindow;
    private final Executor handlerExecutor;
    private final Clock clock;

    private final Deque<EventHistoryEntry> history = new ArrayDeque<>();
    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();
    private final Set<String> sessions = new LinkedHashSet<>();
    private final Deque<Long> processingTimes = new ArrayDeque<>();

    private boolean running;
    private long sequence;
    private Instant lastTimestamp;
    private long totalPublished;
    private long totalHandlerErrors;
    private long totalSubscriptions;

    public InMemoryEventBus(int maxHistorySize, int statsWindow, Executor handlerExecutor, Clock clock) {
        if (maxHistorySize <= 0) {
            throw new ValidationException("History size must be positive: " + maxHistorySize);
        }
        if (statsWindow <= 0) {
            throw new ValidationException("Stats window must be positive: " + statsWindow);
        }
        this.maxHistorySize = maxHistorySize;
        this.statsWindow = statsWindow;
        this.handlerExecutor = handlerExecutor;
        this.clock = clock;
    }

    @Override
    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
        }
        log.info("[EventBus] Started (history size: {})", maxHistorySize);
    }

    @Override
    public void stop() {
        int droppedSubscriptions;
        int droppedSessions;
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            droppedSubscriptions = subscriptions.size();
            droppedSessions = sessions.size();
            subscriptions.clear();
            sessions.clear();
        }
        log.info("[EventBus] Stopped, dropped {} subscriptions and {} sessions", droppedSubscriptions,
                droppedSessions);
    }

    @Override
    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    @Override
    public CompletableFuture<BusEvent> publish(PendingEvent pending) {
        validate(pending);
        long startedAt = System.nanoTime();
        EventHistoryEntry entry;
        List<Subscription> targets;
        synchronized (lock) {
            if (!running) {
                throw new NotRunningException("publish " + pending.type());
            }
            BusEvent event = stamp(pending);
            entry = new EventHistoryEntry(event, ++sequence);
            appendToHistory(entry);
            totalPublished++;
            targets = collectTargets(event);
        }
        BusEvent event = entry.getEvent();
        log.debug("[EventBus] Published {} ({}) to {} subscriptions", event.type(), event.id(), targets.size());

        if (targets.isEmpty()) {
            complete(entry, startedAt);
            return CompletableFuture.completedFuture(event);
        }
        CompletableFuture<?>[] deliveries = new CompletableFuture<?>[targets.size()];
        for (int i = 0; i < targets.size(); i++) {
            deliveries[i] = deliver(targets.get(i), entry);
        }
        return CompletableFuture.allOf(deliveries).handle((ignored, failure) -> {
            complete(entry, startedAt);
            return event;
        });
    }

    @Override
    public String subscribe(Collection<String> eventTypes, EventHandler handler, SubscriptionConfig config) {
        if (eventTypes == null || eventTypes.isEmpty()) {
            throw new ValidationException("Subscription requires at least one event type");
        }
        if (eventTypes.stream().anyMatch(type -> type == null || type.isBlank())) {
            throw new ValidationException("Event types must not be blank");
        }
        if (handler == null) {
            throw new ValidationException("Subscription requires a handler");
        }
        String id = UUID.randomUUID().toString();
        synchronized (lock) {
            if (!running) {
                throw new NotRunningException("subscribe to " + eventTypes);
            }
            subscriptions.put(id, new Subscription(id, Set.copyOf(eventTypes), handler, config, clock.instant()));
            totalSubscriptions++;
        }
        log.debug("[EventBus] Subscription {} registered for {}", id, eventTypes);
        return id;
    }

    @Override
    public boolean unsubscribe(String subscriptionId) {
        if (subscriptionId == null) {
            return false;
        }
        boolean removed;
        synchronized (lock) {
            removed = subscriptions.remove(subscriptionId) != null;
        }
        if (removed) {
            log.debug("[EventBus] Subscription {} removed", subscriptionId);
        }
        return removed;
    }

    @Override
    public List<EventHistoryEntry> getEventHistory(EventFilter filter, int limit) {
        if (limit < 0) {
            throw new ValidationException("History limit must not be negative: " + limit);
        }
        EventFilter effective = filter != null ? filter : EventFilter.any();
        List<EventHistoryEntry> result = new ArrayList<>();
        synchronized (lock) {
            Iterator<EventHistoryEntry> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                EventHistoryEntry entry = newestFirst.next();
                if (effective.matches(entry.getEvent())) {
                    result.add(entry);
                }
            }
        }
        return result;
    }

    @Override
    public int clearEventHistory(EventFilter filter) {
        int removed;
        synchronized (lock) {
            int before = history.size();
            if (filter == null) {
                history.clear();
            } else {
                history.removeIf(entry -> filter.matches(entry.getEvent()));
            }
            removed = before - history.size();
        }
        log.debug("[EventBus] Cleared {} history entries", removed);
        return removed;
    }

    @Override
    public List<Subscription> getActiveSubscriptions() {
        synchronized (lock) {
            return List.copyOf(subscriptions.values());
        }
    }

    @Override
    public String createSession() {
        String sessionId = UUID.randomUUID().toString();
        synchronized (lock) {
            sessions.add(sessionId);
        }
        log.debug("[EventBus] Session {} created", sessionId);
        return sessionId;
    }

    @Override
    public void closeSession(String sessionId) {
        int purged;
        synchronized (lock) {
            if (sessionId == null || !sessions.remove(sessionId)) {
                throw new NotFoundException("Session", sessionId);
            }
            int before = history.size();
            history.removeIf(entry -> sessionId.equals(entry.getEvent().sessionId()));
            purged = before - history.size();
        }
        log.debug("[EventBus] Session {} closed, purged {} events", sessionId, purged);
    }

    @Override
    public Set<String> getActiveSessions() {
        synchronized (lock) {
            return Set.copyOf(sessions);
        }
    }

    @Override
    public EventBusStats getStats() {
        synchronized (lock) {
            Map<String, Integer> byType = new TreeMap<>();
            for (EventHistoryEntry entry : history) {
                byType.merge(entry.getEvent().type(), 1, Integer::sum);
            }
            double averageMs = processingTimes.stream()
                    .mapToLong(Long::longValue)
                    .average()
                    .orElse(0.0) / NANOS_PER_MILLI;
            double errorRate = totalPublished > 0 ? (double) totalHandlerErrors / totalPublished * 100.0 : 0.0;
            return EventBusStats.builder()
                    .totalEvents(history.size())
                    .eventsByType(Map.copyOf(byType))
                    .totalSubscriptions(totalSubscriptions)
                    .activeSubscriptions(subscriptions.size())
                    .activeSessions(sessions.size())
                    .averageProcessingTimeMs(averageMs)
                    .errorRate(errorRate)
                    .totalPublished(totalPublished)
                    .totalHandlerErrors(totalHandlerErrors)
                    .build();
        }
    }

    private static void validate(PendingEvent pending) {
        if (pending == null) {
            throw new ValidationException("Event is required");
        }
        if (pending.payload() == null) {
            throw new ValidationException("Event payload is required");
        }
        if (pending.source() == null) {
            throw new ValidationException("Event source is required for " + pending.type());
        }
    }

    private BusEvent stamp(PendingEvent pending) {
        Instant now = clock.instant();
        if (lastTimestamp != null && now.isBefore(lastTimestamp)) {
            now = lastTimestamp;
        }
        lastTimestamp = now;
        return BusEvent.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(now)
                .source(pending.source())
                .sessionId(pending.sessionId())
                .payload(pending.payload())
                .build();
    }

    private void appendToHistory(EventHistoryEntry entry) {
        history.addLast(entry);
        while (history.size() > maxHistorySize) {
            history.removeFirst();
        }
    }

    private List<Subscription> collectTargets(BusEvent event) {
        List<Subscription> targets = new ArrayList<>();
        Iterator<Subscription> iterator = subscriptions.values().iterator();
        while (iterator.hasNext()) {
            Subscription subscription = iterator.next();
            if (!subscription.matches(event)) {
                continue;
            }
            targets.add(subscription);
            if (subscription.recordDelivery()) {
                iterator.remove();
                log.debug("[EventBus] Subscription {} reached {} deliveries, removed", subscription.getId(),
                        subscription.getConfig().getMaxEvents());
            }
        }
        return targets;
    }

    private CompletableFuture<Void> deliver(Subscription subscription, EventHistoryEntry entry) {
        try {
            return CompletableFuture.runAsync(() -> invoke(subscription, entry), handlerExecutor)
                    .exceptionally(error -> {
                        recordHandlerFailure(subscription, entry, unwrap(error));
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            recordHandlerFailure(subscription, entry, e);
            return CompletableFuture.completedFuture(null);
        }
    }

    private void invoke(Subscription subscription, EventHistoryEntry entry) {
        try {
            subscription.getHandler().onEvent(entry.getEvent());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordHandlerFailure(subscription, entry, e);
        } catch (Exception e) {
            recordHandlerFailure(subscription, entry, e);
        }
    }

    private void recordHandlerFailure(Subscription subscription, EventHistoryEntry entry, Throwable error) {
        BusEvent event = entry.getEvent();
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        entry.addError(message);
        synchronized (lock) {
            totalHandlerErrors++;
        }
        log.error("[EventBus] Handler of subscription {} failed on {} ({})", subscription.getId(), event.type(),
                event.id(), error);
    }

    private void complete(EventHistoryEntry entry, long startedAt) {
        entry.markProcessed(clock.instant());
        long elapsed = System.nanoTime() - startedAt;
        synchronized (lock) {
            processingTimes.addLast(elapsed);
            while (processingTimes.size() > statsWindow) {
                processingTimes.removeFirst();
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
