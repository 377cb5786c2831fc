package me.reasonloop.runtime.domain.exception;

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

import lombok.Getter;

/**
 * Wraps an error raised while processing a single agent step. The agent is in
 * {@code ERROR} status when this is thrown.
 */
@Getter
public class StepFailureException extends ReasonLoopException {

    private static final long serialVersionUID = 1L;

    private final int stepIndex;

    public StepFailureException(int stepIndex, Throwable cause) {
        super("Step " + stepIndex + " failed: " + describe(cause), cause);
        this.stepIndex = stepIndex;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
