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
import me.reasonloop.runtime.domain.model.SubscriptionConfig;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registered interest of one handler in a set of event types.
 */
@Getter
public final class Subscription {

    private final String id;
    private final Set<String> eventTypes;
    private final EventHandler handler;
    private final SubscriptionConfig config;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final AtomicInteger deliveries = new AtomicInteger();

    public Subscription(String id, Set<String> eventTypes, EventHandler handler, SubscriptionConfig config,
            Instant createdAt) {
        this.id = id;
        this.eventTypes = Set.copyOf(eventTypes);
        this.handler = handler;
        this.config = config != null ? config : SubscriptionConfig.defaults();
        this.createdAt = createdAt;
    }

    public boolean matches(BusEvent event) {
        if (!eventTypes.contains(event.type())) {
            return false;
        }
        return config.getFilter() == null || config.getFilter().matches(event);
    }

    public int getDeliveryCount() {
        return deliveries.get();
    }

    /**
     * Count one delivery and report whether the subscription has now used up
     * its cap.
     */
    public boolean recordDelivery() {
        int delivered = deliveries.incrementAndGet();
        return config.isCapped() && delivered >= config.getMaxEvents();
    }
}
