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

import java.util.Map;

/**
 * Point-in-time statistics of an event bus.
 *
 * @param totalEvents
 *            events currently held in history
 * @param eventsByType
 *            history size broken down by event type
 * @param totalSubscriptions
 *            subscriptions registered since the bus was created, including
 *            removed ones
 * @param activeSubscriptions
 *            registered subscriptions
 * @param activeSessions
 *            open sessions
 * @param averageProcessingTimeMs
 *            mean time from publish until every handler settled, over the
 *            most recent publishes
 * @param errorRate
 *            percentage of failed handler invocations per published event
 */
@Builder
public record EventBusStats(
        int totalEvents,
        Map<String, Integer> eventsByType,
        long totalSubscriptions,
        int activeSubscriptions,
        int activeSessions,
        double averageProcessingTimeMs,
        double errorRate,
        long totalPublished,
        long totalHandlerErrors) {
}
