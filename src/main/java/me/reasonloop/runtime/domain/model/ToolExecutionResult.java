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

import java.util.Map;

/**
 * Outcome of one tool call within a step, as recorded in the step and in chat
 * history.
 */
@Value
@Builder
public class ToolExecutionResult {

    String name;
    String callId;
    Map<String, Object> arguments;
    ToolExecutionStatus status;
    Object result;
    String message;
    long executionTime;

    public boolean isSuccess() {
        return status == ToolExecutionStatus.SUCCEED;
    }

    public static ToolExecutionResult failed(ToolCall call, String message, long executionTime) {
        return ToolExecutionResult.builder()
                .name(call.getName())
                .callId(call.getCallId())
                .arguments(call.getArguments())
                .status(ToolExecutionStatus.FAILED)
                .message(message)
                .executionTime(executionTime)
                .build();
    }

    public static ToolExecutionResult from(ToolCall call, ToolResult result, long executionTime) {
        Object payload = result.getData() != null ? result.getData() : result.getOutput();
        return ToolExecutionResult.builder()
                .name(call.getName())
                .callId(call.getCallId())
                .arguments(call.getArguments())
                .status(result.isSuccess() ? ToolExecutionStatus.SUCCEED : ToolExecutionStatus.FAILED)
                .result(result.isSuccess() ? payload : null)
                .message(result.isSuccess() ? result.getOutput() : result.getError())
                .executionTime(executionTime)
                .build();
    }
}
