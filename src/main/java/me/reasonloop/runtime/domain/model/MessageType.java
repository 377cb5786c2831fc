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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a chat history message. Retention windows are configured per
 * category.
 */
public enum MessageType {

    MESSAGE("message", 100),
    TOOL_CALL("tool-call", 5),
    ERROR("error", 5),
    THINKING("thinking", 5),
    ANALYSIS("analysis", 5),
    PLAN("plan", 5),
    REASONING("reasoning", 5),
    INTERACTIVE("interactive", 5),
    RESPONSE("response", 5),
    STOP_SIGNAL("stop-signal", 2);

    private final String value;
    private final int defaultKeepSteps;

    MessageType(String value, int defaultKeepSteps) {
        this.value = value;
        this.defaultKeepSteps = defaultKeepSteps;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Number of steps a message of this type stays visible when nothing else is
     * configured.
     */
    public int getDefaultKeepSteps() {
        return defaultKeepSteps;
    }

    @JsonCreator
    public static MessageType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (MessageType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + value);
    }
}
