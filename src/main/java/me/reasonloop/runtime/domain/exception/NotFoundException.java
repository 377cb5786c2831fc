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
 * Raised when an operation references a session, subscription or step that
 * does not exist.
 */
@Getter
public class NotFoundException extends ReasonLoopException {

    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String identifier;

    public NotFoundException(String kind, String identifier) {
        super(kind + " not found: " + identifier);
        this.kind = kind;
        this.identifier = identifier;
    }
}
