package me.reasonloop.runtime.domain.bus;

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

import me.reasonloop.runtime.domain.model.BusEvent;
import me.reasonloop.runtime.domain.model.EventBusStats;
import me.reasonloop.runtime.domain.model.EventFilter;
import me.reasonloop.runtime.domain.model.EventHistoryEntry;
import me.reasonloop.runtime.domain.model.PendingEvent;
import me.reasonloop.runtime.domain.model.SubscriptionConfig;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * In-process publish/subscribe hub shared by agents and interactive clients.
 *
 * <p>
 * Publishing stamps the event with a unique id and the current time, appends
 * it to a bounded history and delivers it to every matching subscription. The
 * returned future completes once every handler has settled, whether it
 * succeeded or failed; a failing handler never affects the publisher or the
 * other handlers.
 *
 * <p>
 * Events can be scoped to sessions. Closing a session removes its events from
 * history.
 *
 * @since 1.0
 */
public interface EventBus {

    int DEFAULT_HISTORY_LIMIT = 100;

    /**
     * Enable publishing and subscribing. Idempotent.
     */
    void start();

    /**
     * Disable publishing and subscribing, dropping every subscription and
     * session. History stays queryable. Idempotent.
     */
    void stop();

    boolean isRunning();

    CompletableFuture<BusEvent> publish(PendingEvent event);

    /**
     * Register a handler for the given event types.
     *
     * @return the subscription id
     */
    String subscribe(Collection<String> eventTypes, EventHandler handler, SubscriptionConfig config);

    default String subscribe(String eventType, EventHandler handler) {
        return subscribe(Set.of(eventType), handler, SubscriptionConfig.defaults());
    }

    default String subscribe(String eventType, EventHandler handler, SubscriptionConfig config) {
        return subscribe(Set.of(eventType), handler, config);
    }

    /**
     * @return true if a subscription was removed
     */
    boolean unsubscribe(String subscriptionId);

    /**
     * History entries matching the filter, newest first, at most {@code limit}
     * of them.
     */
    List<EventHistoryEntry> getEventHistory(EventFilter filter, int limit);

    default List<EventHistoryEntry> getEventHistory(EventFilter filter) {
        return getEventHistory(filter, DEFAULT_HISTORY_LIMIT);
    }

    default List<EventHistoryEntry> getEventHistory() {
        return getEventHistory(null, DEFAULT_HISTORY_LIMIT);
    }

    /**
     * Remove matching history entries; a {@code null} filter removes all.
     *
     * @return number of removed entries
     */
    int clearEventHistory(EventFilter filter);

    List<Subscription> getActiveSubscriptions();

    String createSession();

    /**
     * Close a session and purge its events from history.
     *
     * @throws me.reasonloop.runtime.domain.exception.NotFoundException
     *             if the session is not open
     */
    void closeSession(String sessionId);

    Set<String> getActiveSessions();

    EventBusStats getStats();
}
