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

import java.time.Instant;
import java.util.Set;

/**
 * Conjunction of optional criteria over bus events. Absent criteria match
 * everything; the time bounds are inclusive.
 */
@Value
@Builder(toBuilder = true)
public class EventFilter {

    private static final EventFilter ANY = EventFilter.builder().build();

    Set<String> eventTypes;
    Set<EventSource> sources;
    String sessionId;
    Instant after;
    Instant before;

    public static EventFilter any() {
        return ANY;
    }

    public static EventFilter forSession(String sessionId) {
        return EventFilter.builder().sessionId(sessionId).build();
    }

    public static EventFilter forTypes(Set<String> eventTypes) {
        return EventFilter.builder().eventTypes(eventTypes).build();
    }

    public boolean matches(BusEvent event) {
        if (eventTypes != null && !eventTypes.isEmpty() && !eventTypes.contains(event.type())) {
            return false;
        }
        if (sources != null && !sources.isEmpty() && !sources.contains(event.source())) {
            return false;
        }
        if (sessionId != null && !sessionId.equals(event.sessionId())) {
            return false;
        }
        if (after != null && event.timestamp().isBefore(after)) {
            return false;
        }
        return before == null || !event.timestamp().isAfter(before);
    }
}
