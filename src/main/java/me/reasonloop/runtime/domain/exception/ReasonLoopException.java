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

/**
 * Base type for every failure raised by the runtime core.
 *
 * <p>
 * Callers that only need to know that the runtime rejected an operation can
 * catch this type; the subclasses carry the distinct failure kinds.
 *
 * @since 1.0
 */
public class ReasonLoopException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReasonLoopException(String message) {
        super(message);
    }

    public ReasonLoopException(String message, Throwable cause) {
        super(message, cause);
    }
}
