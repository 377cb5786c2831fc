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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Record of a published event kept in the bus history, together with the
 * errors raised by its handlers.
 */
public final class EventHistoryEntry {

    private final BusEvent event;
    private final long sequence;
    private final List<String> errors = new ArrayList<>();
    private volatile boolean processed;
    private volatile Instant processedAt;

    public EventHistoryEntry(BusEvent event, long sequence) {
        this.event = event;
        this.sequence = sequence;
    }

    public BusEvent getEvent() {
        return event;
    }

    public long getSequence() {
        return sequence;
    }

    public boolean isProcessed() {
        return processed;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public List<String> getErrors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }

    public void addError(String error) {
        synchronized (errors) {
            errors.add(error);
        }
    }

    public void markProcessed(Instant at) {
        this.processedAt = at;
        this.processed = true;
    }
}
