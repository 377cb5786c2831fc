package me.reasonloop.runtime.domain.bus;

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

import me.reasonloop.runtime.domain.model.BusEvent;

/**
 * Callback invoked by the bus for every matching event. Handlers run on the
 * bus's handler executor, concurrently with the other handlers of the same
 * event. A thrown exception is recorded against the event and never reaches
 * the publisher.
 */
@FunctionalInterface
public interface EventHandler {

    void onEvent(BusEvent event) throws Exception;
}
