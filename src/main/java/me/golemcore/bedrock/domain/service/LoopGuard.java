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
import me.golemcore.bedrock.infrastructure.config.BedrockProperties;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Detects an agent stuck searching or re-planning instead of answering.
 *
 * <p>
 * Looks at the last {@code window} turns (default 5) and counts turns that
 * mention a search ({@code web_search}, {@code searching}) and turns with
 * planning phrases. Two search turns or three planning turns mean a loop.
 * Histories shorter than three turns never loop.
 *
 * <p>
 * A conversation whose latest turn asks for page output ({@code landing page},
 * {@code html}, {@code css}) is exempt: the agent needs its tools there.
 *
 * <p>
 * Stateless; safe to share between concurrent requests.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoopGuard {

    static final List<String> SEARCH_MARKERS = List.of("web_search", "searching");
    static final List<String> PLANNING_MARKERS = List.of(
            "let's plan", "let's break", "planning", "we need to", "plan the creation");
    static final List<String> CONTENT_GENERATION_MARKERS = List.of("landing page", "html", "css");

    private final BedrockProperties properties;

    public boolean shouldForceTerminate(List<ConversationTurn> history) {
        return assess(history).shouldForceTerminate();
    }

    public boolean shouldForceTerminate(List<ConversationTurn> history, int window) {
        return assess(history, window).shouldForceTerminate();
    }

    public LoopAssessment assess(List<ConversationTurn> history) {
        return assess(history, properties.getLoopGuard().getWindow());
    }

    /**
     * Classify the last {@code window} turns of a history.
     *
     * @throws IllegalArgumentException
     *             if {@code window} is not positive
     */
    public LoopAssessment assess(List<ConversationTurn> history, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Loop guard window must be positive, got " + window);
        }
        BedrockProperties.LoopGuardProperties config = properties.getLoopGuard();
        if (!config.isEnabled() || history == null || history.isEmpty()) {
            return LoopAssessment.none();
        }

        List<ConversationTurn> recent = history.subList(Math.max(0, history.size() - window), history.size());
        int searchCount = 0;
        int planningCount = 0;
        for (ConversationTurn turn : recent) {
            String content = turn.normalizedContent();
            if (containsAny(content, SEARCH_MARKERS)) {
                searchCount++;
            }
            if (containsAny(content, PLANNING_MARKERS)) {
                planningCount++;
            }
        }

        boolean loopDetected = history.size() >= config.getMinHistory()
                && (searchCount >= config.getSearchThreshold() || planningCount >= config.getPlanningThreshold());
        boolean contentGeneration = containsAny(history.get(history.size() - 1).normalizedContent(),
                CONTENT_GENERATION_MARKERS);

        if (loopDetected) {
            if (contentGeneration) {
                log.debug("[LoopGuard] Loop pattern ({} searches, {} planning) ignored for content generation",
                        searchCount, planningCount);
            } else {
                log.info("[LoopGuard] Loop detected: {} searches, {} planning turns in last {} turns",
                        searchCount, planningCount, recent.size());
            }
        }
        return new LoopAssessment(searchCount, planningCount, loopDetected, contentGeneration);
    }

    private static boolean containsAny(String content, List<String> markers) {
        for (String marker : markers) {
            if (content.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
