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

/**
 * Structured view of the model's text: the thinking sections and the
 * interactive reply. Absent sections are {@code null}.
 */
public record ExtractorResult(
        String analysis,
        String plan,
        String reasoning,
        String response,
        String stopSignal) {

    public boolean hasThinking() {
        return analysis != null || plan != null || reasoning != null;
    }

    public boolean isStopRequested() {
        return stopSignal != null && !stopSignal.isBlank();
    }
}
