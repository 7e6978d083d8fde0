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

/**
 * Loop guard verdict over the recent window of a conversation.
 *
 * @param searchCount
 *            turns in the window mentioning a web search
 * @param planningCount
 *            turns in the window containing planning phrases
 * @param loopDetected
 *            whether a repetition threshold was crossed
 * @param contentGeneration
 *            whether the latest turn asks for page/markup output, which exempts
 *            the conversation from forced termination
 */
public record LoopAssessment(int searchCount, int planningCount, boolean loopDetected, boolean contentGeneration) {

    public static LoopAssessment none() {
        return new LoopAssessment(0, 0, false, false);
    }

    public boolean shouldForceTerminate() {
        return loopDetected && !contentGeneration;
    }

    /**
     * A search already happened in the window, so further {@code web_search}
     * calls are suppressed.
     */
    public boolean searchAlreadyPerformed() {
        return searchCount >= 1;
    }
}
