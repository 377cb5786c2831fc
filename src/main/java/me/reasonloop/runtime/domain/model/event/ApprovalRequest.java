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

import me.reasonloop.runtime.domain.model.ActionType;
import me.reasonloop.runtime.domain.model.EventTypes;
import me.reasonloop.runtime.domain.model.RiskLevel;
import lombok.Builder;

import java.time.Duration;
import java.util.List;

/**
 * Request for a human decision before an action runs. A {@code null} timeout
 * means the configured default applies.
 */
@Builder(toBuilder = true)
public record ApprovalRequest(
        String requestId,
        ActionType actionType,
        String description,
        Details details,
        Duration timeout) implements EventPayload {

    @Override
    public String type() {
        return EventTypes.APPROVAL_REQUEST;
    }

    @Builder
    public record Details(
            String toolName,
            String command,
            List<String> filePaths,
            RiskLevel riskLevel,
            String preview) {
    }
}
