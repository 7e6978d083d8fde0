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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Interpreted model output: prose segments, recovered tool calls and a rough
 * usage estimate (word count of the raw text).
 */
@Value
@Builder
public class InterpretedResult {

    @Singular
    List<String> textSegments;

    @Singular
    List<ToolCall> toolCalls;

    int usageEstimate;

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    /**
     * All text segments joined by a blank line.
     */
    public String text() {
        return String.join("\n\n", textSegments);
    }
}
