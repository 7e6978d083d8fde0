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

package me.golemcore.bedrock.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bedrock.domain.model.ParsedToolCalls;
import me.golemcore.bedrock.domain.model.ToolCall;
import me.golemcore.bedrock.domain.model.ToolParseException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers tool calls written into free-form model output as
 * {@code {"name": "<tool>", "arguments": {...}}}.
 *
 * <p>
 * Matching is regex based and balances braces inside {@code arguments} one
 * level deep only: {@code {"a": {"b": 1}}} is recognized,
 * {@code {"a": {"b": {"c": 1}}}} is not. Unrecognized text stays in the
 * remaining prose.
 *
 * <p>
 * Arguments that are not valid JSON get one repair pass (single quotes become
 * double quotes). A match that still fails is logged, left in the text and
 * skipped; later matches are still parsed.
 *
 * <p>
 * When the recent conversation already contains a search, {@code web_search}
 * calls are dropped. Their JSON stays in the remaining prose like any other
 * unaccepted match. Several {@code web_search} calls in one response are all
 * kept when no earlier search happened.
 */
@Service
@Slf4j
public class ToolCallParser {

    public static final String WEB_SEARCH_TOOL = "web_search";

    private static final Pattern TOOL_CALL_PATTERN = Pattern.compile(
            "\\{\\s*\"name\":\\s*\"([^\"]+)\",\\s*\"arguments\":\\s*(\\{(?:[^{}]|(?:\\{[^{}]*\\}))*\\})\\s*\\}",
            Pattern.DOTALL);

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parse without any search history.
     */
    public ParsedToolCalls parse(String text) {
        return parse(text, false);
    }

    /**
     * Parse tool calls out of model text.
     *
     * @param text
     *            raw model output
     * @param searchAlreadyPerformed
     *            whether the recent conversation window already contains a
     *            search
     * @return accepted calls and the remaining prose; when both would be empty
     *         the original text is returned as the remaining prose
     */
    public ParsedToolCalls parse(String text, boolean searchAlreadyPerformed) {
        if (text == null || text.isEmpty()) {
            return new ParsedToolCalls(List.of(), "", 0, 0);
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        String remaining = "";
        int cursor = 0;
        int skipped = 0;
        int suppressed = 0;

        Matcher matcher = TOOL_CALL_PATTERN.matcher(text);
        while (matcher.find()) {
            String toolName = matcher.group(1);

            if (searchAlreadyPerformed && WEB_SEARCH_TOOL.equals(toolName)) {
                log.info("[ToolParser] Dropping additional {} call, a search was already performed", toolName);
                suppressed++;
                continue;
            }

            Map<String, Object> arguments;
            try {
                arguments = parseArguments(matcher.group(2));
            } catch (ToolParseException e) {
                log.warn("[ToolParser] Skipping tool call '{}': {}", toolName, e.getMessage());
                skipped++;
                continue;
            }

            toolCalls.add(new ToolCall(ToolCall.callIdFor(toolCalls.size()), toolName, arguments));
            remaining = splice(remaining, text.substring(cursor, matcher.start()));
            cursor = matcher.end();
        }
        remaining = splice(remaining, text.substring(cursor)).strip();

        if (toolCalls.isEmpty() && remaining.isEmpty()) {
            remaining = text;
        }
        log.debug("[ToolParser] Parsed {} tool calls ({} skipped, {} suppressed)", toolCalls.size(), skipped,
                suppressed);
        return new ParsedToolCalls(toolCalls, remaining, skipped, suppressed);
    }

    private Map<String, Object> parseArguments(String json) {
        try {
            return objectMapper.readValue(json, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            String repaired = json.replace('\'', '"');
            try {
                return objectMapper.readValue(repaired, ARGUMENTS_TYPE);
            } catch (JsonProcessingException repairFailure) {
                throw new ToolParseException("invalid arguments JSON: " + repairFailure.getOriginalMessage(),
                        repairFailure);
            }
        }
    }

    /**
     * Join the text before a removed call with the text after it. A newline
     * next to the removed span is kept as the separator, otherwise one space.
     */
    private static String splice(String before, String after) {
        if (before.isEmpty()) {
            return after;
        }
        String head = before.stripTrailing();
        String tail = after.stripLeading();
        if (head.isEmpty() || tail.isEmpty()) {
            return head + tail;
        }
        boolean newlineBorder = before.substring(head.length()).contains("\n")
                || after.substring(0, after.length() - tail.length()).contains("\n");
        return head + (newlineBorder ? "\n" : " ") + tail;
    }
}
