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
import lombok.Builder;

@Builder
public record ExecutionModeChangeRequest(
        String requestId,
        ExecutionMode fromMode,
        ExecutionMode toMode,
        String reason) implements EventPayload {

    @Override
    public String type() {
        return EventTypes.EXECUTION_MODE_CHANGE_REQUEST;
    }
}
