package me.reasonloop.runtime.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Options of a subscription.
 *
 * <p>
 * {@code maxEvents} caps the number of deliveries to a non-persistent
 * subscription, which is removed once the cap is reached. Zero or a negative
 * value means no cap. Persistent subscriptions are never capped.
 */
@Value
@Builder
public class SubscriptionConfig {

    private static final SubscriptionConfig DEFAULTS = SubscriptionConfig.builder().build();

    EventFilter filter;

    @Builder.Default
    boolean persistent = false;

    @Builder.Default
    int maxEvents = 0;

    public static SubscriptionConfig defaults() {
        return DEFAULTS;
    }

    public static SubscriptionConfig filtered(EventFilter filter) {
        return SubscriptionConfig.builder().filter(filter).build();
    }

    public boolean isCapped() {
        return !persistent && maxEvents > 0;
    }
}
