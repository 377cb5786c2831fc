package me.reasonloop.runtime.domain.prompt;

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

import me.reasonloop.runtime.domain.model.ExtractorResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the model's text into its tagged sections.
 *
 * <pre>
 * &lt;think&gt;
 *   &lt;analysis&gt;...&lt;/analysis&gt; &lt;plan&gt;...&lt;/plan&gt; &lt;reasoning&gt;...&lt;/reasoning&gt;
 * &lt;/think&gt;
 * &lt;interactive&gt;
 *   &lt;response&gt;...&lt;/response&gt; &lt;stop_signal&gt;...&lt;/stop_signal&gt;
 * &lt;/interactive&gt;
 * </pre>
 *
 * Tags are matched case-insensitively. Text without any tag is taken as the
 * response as a whole.
 */
public class ResponseExtractor {

    private static final String THINK = "think";
    private static final String INTERACTIVE = "interactive";

    public ExtractorResult extract(String text) {
        if (text == null || text.isBlank()) {
            return new ExtractorResult(null, null, null, null, null);
        }
        String think = section(text, THINK);
        String interactive = section(text, INTERACTIVE);

        String thinkScope = think != null ? think : text;
        String interactiveScope = interactive != null ? interactive : text;

        String analysis = section(thinkScope, "analysis");
        String plan = section(thinkScope, "plan");
        String reasoning = section(thinkScope, "reasoning");
        if (think != null && analysis == null && plan == null && reasoning == null) {
            reasoning = think;
        }

        String response = section(interactiveScope, "response");
        String stopSignal = section(interactiveScope, "stop_signal");
        if (response == null && interactive == null && think == null && !containsTag(text)) {
            response = text.strip();
        }
        return new ExtractorResult(analysis, plan, reasoning, response, stopSignal);
    }

    static String section(String text, String tag) {
        Pattern pattern = Pattern.compile("<" + tag + ">(.*?)</" + tag + ">",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String content = matcher.group(1).strip();
        return content.isEmpty() ? null : content;
    }

    private static boolean containsTag(String text) {
        return Pattern.compile("<(analysis|plan|reasoning|response|stop_signal)>", Pattern.CASE_INSENSITIVE)
                .matcher(text)
                .find();
    }
}
