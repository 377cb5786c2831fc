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
import lombok.Builder;

import java.time.Instant;

/**
 * Event as stored and delivered by the bus. Identity and timestamp are always
 * assigned by the bus at publish time.
 */
@Builder(toBuilder = true)
public record BusEvent(
        String id,
        Instant timestamp,
        EventSource source,
        String sessionId,
        EventPayload payload) {

    public String type() {
        return payload.type();
    }

    /**
     * Typed access to the payload; returns {@code null} when the payload is of a
     * different type.
     */
    public <T extends EventPayload> T payloadAs(Class<T> payloadType) {
        return payloadType.isInstance(payload) ? payloadType.cast(payload) : null;
    }
}
