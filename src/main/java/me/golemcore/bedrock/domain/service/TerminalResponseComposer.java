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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bedrock.domain.model.ConversationTurn;
import me.golemcore.bedrock.domain.model.LoopAssessment;
import me.golemcore.bedrock.domain.model.TerminalResponse;
import me.golemcore.bedrock.infrastructure.config.BedrockProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Builds the final answer returned in place of a model call when the loop
 * guard stops a searching/planning loop. The answer wraps the most recent
 * assistant findings in the {@code prompts/terminal-response.md} template.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TerminalResponseComposer {

    static final String NO_FINDINGS = "No additional findings were produced beyond the conversation above.";

    private static final String DEFAULT_TEMPLATE = """
            Based on the research already carried out in this conversation, here is the final answer.

            {{findings}}
            """;

    private final BedrockProperties properties;
    private final PromptTemplateEngine templateEngine;
    private final ToolCallParser toolCallParser;

    private volatile String template;

    public TerminalResponse compose(List<ConversationTurn> history, LoopAssessment assessment) {
        int window = properties.getLoopGuard().getWindow();
        String findings = latestFindings(history, window);

        String text = templateEngine.render(template(), Map.of(
                "findings", findings,
                "search_count", String.valueOf(assessment.searchCount()),
                "planning_count", String.valueOf(assessment.planningCount()),
                "window", String.valueOf(window))).strip();

        log.info("[LoopGuard] Synthesized terminal response ({} searches, {} planning turns)",
                assessment.searchCount(), assessment.planningCount());
        return new TerminalResponse(text, assessment.searchCount(), assessment.planningCount(),
                PromptTemplateEngine.countWords(text));
    }

    private String latestFindings(List<ConversationTurn> history, int window) {
        if (history == null || history.isEmpty()) {
            return NO_FINDINGS;
        }
        int from = Math.max(0, history.size() - window);
        for (int i = history.size() - 1; i >= from; i--) {
            ConversationTurn turn = history.get(i);
            if (!turn.isAssistant()) {
                continue;
            }
            // Embedded tool calls are requests, not findings
            String prose = toolCallParser.parse(turn.content()).remainingText().strip();
            if (!prose.isEmpty()) {
                return prose;
            }
        }
        return NO_FINDINGS;
    }

    private String template() {
        String loaded = template;
        if (loaded == null) {
            loaded = PromptResources.load(properties.getLoopGuard().getTerminalResponseTemplate(),
                    DEFAULT_TEMPLATE);
            template = loaded;
        }
        return loaded;
    }
}
