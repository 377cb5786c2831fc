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

import java.util.List;

/**
 * Wire names of every event type understood by the runtime.
 */
public final class EventTypes {

    public static final String EXECUTION_MODE_CHANGE_REQUEST = "execution_mode_change_request";
    public static final String EXECUTION_MODE_CHANGE_RESPONSE = "execution_mode_change_response";
    public static final String APPROVAL_REQUEST = "approval_request";
    public static final String APPROVAL_RESPONSE = "approval_response";
    public static final String INPUT_REQUEST = "input_request";
    public static final String INPUT_RESPONSE = "input_response";
    public static final String COLLABORATION_REQUEST = "collaboration_request";
    public static final String COLLABORATION_RESPONSE = "collaboration_response";
    public static final String USER_MESSAGE = "user_message";
    public static final String AGENT_STEP = "agent_step";
    public static final String AGENT_STATE_CHANGE = "agent_state_change";
    public static final String AGENT_THINKING = "agent_thinking";
    public static final String AGENT_REPLY = "agent_reply";
    public static final String TOOL_EXECUTION_RESULT = "tool_execution_result";
    public static final String REQUEST_TIMEOUT = "request_timeout";
    public static final String SESSION_STARTED = "session_started";
    public static final String SESSION_ENDED = "session_ended";
    public static final String ERROR_OCCURRED = "error_occurred";

    public static final List<String> ALL = List.of(
            EXECUTION_MODE_CHANGE_REQUEST, EXECUTION_MODE_CHANGE_RESPONSE,
            APPROVAL_REQUEST, APPROVAL_RESPONSE,
            INPUT_REQUEST, INPUT_RESPONSE,
            COLLABORATION_REQUEST, COLLABORATION_RESPONSE,
            USER_MESSAGE, AGENT_STEP, AGENT_STATE_CHANGE, AGENT_THINKING, AGENT_REPLY,
            TOOL_EXECUTION_RESULT, REQUEST_TIMEOUT, SESSION_STARTED, SESSION_ENDED, ERROR_OCCURRED);

    private EventTypes() {
    }
}
