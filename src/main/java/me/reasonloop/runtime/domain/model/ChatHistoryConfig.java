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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Immutable mapping from message type to the number of steps its messages stay
 * visible. A window of zero keeps messages for the whole session.
 */
public final class ChatHistoryConfig {

    private final Map<MessageType, Integer> keepSteps;

    private ChatHistoryConfig(Map<MessageType, Integer> keepSteps) {
        this.keepSteps = Collections.unmodifiableMap(keepSteps);
    }

    /**
     * Built-in windows for every message type.
     */
    public static ChatHistoryConfig defaults() {
        Map<MessageType, Integer> windows = new EnumMap<>(MessageType.class);
        for (MessageType type : MessageType.values()) {
            windows.put(type, type.getDefaultKeepSteps());
        }
        return new ChatHistoryConfig(windows);
    }

    public static ChatHistoryConfig empty() {
        return new ChatHistoryConfig(new EnumMap<>(MessageType.class));
    }

    public OptionalInt keepSteps(MessageType type) {
        Integer window = keepSteps.get(type);
        return window != null ? OptionalInt.of(window) : OptionalInt.empty();
    }

    /**
     * Returns a copy with the given type's window replaced.
     */
    public ChatHistoryConfig with(MessageType type, int steps) {
        Map<MessageType, Integer> copy = copyOf(keepSteps);
        copy.put(type, steps);
        return new ChatHistoryConfig(copy);
    }

    /**
     * Returns a copy with every given window layered over this one.
     */
    public ChatHistoryConfig merge(Map<MessageType, Integer> overrides) {
        Map<MessageType, Integer> copy = copyOf(keepSteps);
        if (overrides != null) {
            copy.putAll(overrides);
        }
        return new ChatHistoryConfig(copy);
    }

    public Map<MessageType, Integer> asMap() {
        return keepSteps;
    }

    private static Map<MessageType, Integer> copyOf(Map<MessageType, Integer> source) {
        Map<MessageType, Integer> copy = new EnumMap<>(MessageType.class);
        copy.putAll(source);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ChatHistoryConfig other && keepSteps.equals(other.keepSteps));
    }

    @Override
    public int hashCode() {
        return keepSteps.hashCode();
    }

    @Override
    public String toString() {
        return "ChatHistoryConfig" + keepSteps;
    }
}
