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
package me.golemcore.bedrock.domain.model;

import java.util.List;

/**
 * Output of the tool-call parser.
 *
 * @param toolCalls
 *            accepted calls in scan order
 * @param remainingText
 *            input text with accepted calls cut out, trimmed; dropped and
 *            unparseable matches stay in place
 * @param skippedMatches
 *            matches whose arguments could not be parsed
 * @param suppressedCalls
 *            matches dropped by the call filter
 */
public record ParsedToolCalls(List<ToolCall> toolCalls, String remainingText, int skippedMatches,
        int suppressedCalls) {

    public ParsedToolCalls {
        toolCalls = List.copyOf(toolCalls);
        remainingText = remainingText != null ? remainingText : "";
    }

    public boolean isEmpty() {
        return toolCalls.isEmpty() && remainingText.isBlank();
    }
}
