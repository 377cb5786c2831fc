package me.reasonloop.runtime.domain.model.event;

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

import me.reasonloop.runtime.domain.model.EventTypes;
import me.reasonloop.runtime.domain.model.ExecutionMode;

/**
 * Answer to an {@link ExecutionModeChangeRequest}. {@code mode} is the mode the
 * agent will use from its next step on; {@code error} is set when
 * {@code success} is false.
 */
public record ExecutionModeChangeResponse(
        String requestId,
        ExecutionMode mode,
        boolean success,
        String error) implements EventPayload {

    public static ExecutionModeChangeResponse accepted(String requestId, ExecutionMode mode) {
        return new ExecutionModeChangeResponse(requestId, mode, true, null);
    }

    public static ExecutionModeChangeResponse rejected(String requestId, ExecutionMode mode, String error) {
        return new ExecutionModeChangeResponse(requestId, mode, false, error);
    }

    @Override
    public String type() {
        return EventTypes.EXECUTION_MODE_CHANGE_RESPONSE;
    }
}
