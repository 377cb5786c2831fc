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

import java.util.HashMap;
import java.util.Map;

/**
 * Tool invocation requested by the model.
 */
@Value
@Builder(toBuilder = true)
public class ToolCall {

    String callId;
    String name;
    Map<String, Object> arguments;

    /**
     * Returns a copy with one argument added or replaced.
     */
    public ToolCall withArgument(String key, Object value) {
        Map<String, Object> copy = arguments != null ? new HashMap<>(arguments) : new HashMap<>();
        copy.put(key, value);
        return toBuilder().arguments(copy).build();
    }
}
