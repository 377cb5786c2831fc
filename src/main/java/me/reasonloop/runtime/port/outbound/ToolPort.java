package me.reasonloop.runtime.port.outbound;

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

import me.reasonloop.runtime.domain.model.ToolCall;
import me.reasonloop.runtime.domain.model.ToolDefinition;
import me.reasonloop.runtime.domain.model.ToolResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the external tools an agent may call. Built-in tools are not
 * listed here.
 */
public interface ToolPort {

    List<ToolDefinition> listTools();

    /**
     * Runs the tool named by the call. Implementations report tool-level
     * problems through a failed {@link ToolResult}; an exceptionally completed
     * future is treated the same way.
     */
    CompletableFuture<ToolResult> execute(ToolCall toolCall);
}
