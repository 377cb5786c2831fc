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

import me.reasonloop.runtime.domain.model.event.EventPayload;

/**
 * Event submitted by a publisher, before the bus stamps it with identity and
 * timestamp.
 */
public record PendingEvent(EventSource source, String sessionId, EventPayload payload) {

    public static final String DEFAULT_SESSION = "default";

    public PendingEvent {
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = DEFAULT_SESSION;
        }
    }

    public static PendingEvent of(EventSource source, String sessionId, EventPayload payload) {
        return new PendingEvent(source, sessionId, payload);
    }

    public String type() {
        return payload != null ? payload.type() : null;
    }
}
