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

import java.util.Locale;
import java.util.Objects;

/**
 * One immutable turn of the conversation history. Order of turns is
 * significant: the most recent turns drive loop detection.
 *
 * @param role
 *            who produced the turn
 * @param content
 *            plain text content, never null
 */
public record ConversationTurn(TurnRole role, String content) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        content = content != null ? content : "";
    }

    public static ConversationTurn system(String content) {
        return new ConversationTurn(TurnRole.SYSTEM, content);
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(TurnRole.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(TurnRole.ASSISTANT, content);
    }

    public boolean isSystem() {
        return role == TurnRole.SYSTEM;
    }

    public boolean isAssistant() {
        return role == TurnRole.ASSISTANT;
    }

    /**
     * Content lowercased with the root locale, for keyword matching.
     */
    public String normalizedContent() {
        return content.toLowerCase(Locale.ROOT);
    }
}
