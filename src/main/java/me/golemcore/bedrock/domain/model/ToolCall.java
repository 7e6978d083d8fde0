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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tool invocation recovered from model output.
 *
 * @param callId
 *            {@code call_<index>}, unique within one {@link InterpretedResult}
 * @param toolName
 *            name of the requested tool
 * @param arguments
 *            parsed argument object, insertion ordered
 */
public record ToolCall(String callId, String toolName, Map<String, Object> arguments) {

    private static final String CALL_ID_PREFIX = "call_";

    public ToolCall {
        arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Map.of();
    }

    public static String callIdFor(int index) {
        return CALL_ID_PREFIX + index;
    }
}
