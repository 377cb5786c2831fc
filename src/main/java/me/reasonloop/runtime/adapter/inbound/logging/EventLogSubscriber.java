package me.reasonloop.runtime.adapter.inbound.logging;

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
import me.reasonloop.runtime.domain.model.BusEvent;
import me.reasonloop.runtime.domain.model.EventTypes;
import me.reasonloop.runtime.domain.model.SubscriptionConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes a one-line trace of every bus event to the log. Read-only observer
 * used for diagnostics.
 *
 * <p>
 * Stopping the bus drops the trace subscription; {@link #init()} registers it
 * again once the bus has been restarted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventLogSubscriber {

    private final EventBus eventBus;

    private volatile String subscriptionId;

    @PostConstruct
    public synchronized void init() {
        if (isTracing()) {
            return;
        }
        if (!eventBus.isRunning()) {
            log.info("[EventLog] Event bus not running, event trace disabled");
            return;
        }
        subscriptionId = eventBus.subscribe(EventTypes.ALL, this::onEvent,
                SubscriptionConfig.builder().persistent(true).build());
        log.info("[EventLog] Tracing {} event types", EventTypes.ALL.size());
    }

    @PreDestroy
    public synchronized void destroy() {
        if (subscriptionId != null) {
            eventBus.unsubscribe(subscriptionId);
            subscriptionId = null;
        }
    }

    /**
     * Whether the trace subscription is still registered on the bus.
     */
    public boolean isTracing() {
        String current = subscriptionId;
        if (current == null) {
            return false;
        }
        boolean registered = eventBus.getActiveSubscriptions().stream()
                .anyMatch(subscription -> current.equals(subscription.getId()));
        if (!registered) {
            log.info("[EventLog] Trace subscription {} was dropped by the event bus", current);
            subscriptionId = null;
        }
        return registered;
    }

    void onEvent(BusEvent event) {
        log.debug("[EventLog] {} from {} in session {} ({})", event.type(), event.source().getValue(),
                event.sessionId(), event.id());
    }
}
