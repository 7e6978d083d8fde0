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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bedrock.domain.codec.ProviderCodecs;
import me.golemcore.bedrock.domain.model.ConversationTurn;
import me.golemcore.bedrock.domain.model.FormatException;
import me.golemcore.bedrock.domain.model.ProviderEnvelope;
import me.golemcore.bedrock.domain.model.ProviderFamily;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a provider-agnostic conversation into the request body of the target
 * model's family.
 *
 * <p>
 * Turn order is preserved and no non-system turn is dropped. The request
 * system prompt and every system turn are joined with newlines into a single
 * system slot, which the family codec places in a {@code system} field or in a
 * synthesized leading user turn.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestFormatter {

    private final ObjectMapper objectMapper;

    /**
     * @throws FormatException
     *             for an empty history, {@code maxTokens <= 0}, a temperature
     *             outside [0, 1] or a model id of no known family
     */
    public ProviderEnvelope format(List<ConversationTurn> messages, String systemPrompt, int maxTokens,
            double temperature, String modelId) {
        if (messages == null || messages.isEmpty()) {
            throw new FormatException("Conversation history must not be empty");
        }
        if (maxTokens <= 0) {
            throw new FormatException("max_tokens must be positive, got " + maxTokens);
        }
        if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 1.0) {
            throw new FormatException("temperature must be within [0, 1], got " + temperature);
        }
        ProviderFamily family = ProviderFamily.fromModelId(modelId)
                .orElseThrow(() -> new FormatException("Unsupported model family for '" + modelId + "'"));

        List<String> systemParts = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            systemParts.add(systemPrompt);
        }
        List<ConversationTurn> turns = new ArrayList<>(messages.size());
        for (ConversationTurn turn : messages) {
            if (turn.isSystem()) {
                if (!turn.content().isBlank()) {
                    systemParts.add(turn.content());
                }
            } else {
                turns.add(turn);
            }
        }
        String systemText = systemParts.isEmpty() ? null : String.join("\n", systemParts);

        ObjectNode body = ProviderCodecs.forFamily(family)
                .format(turns, systemText, maxTokens, temperature, objectMapper);
        log.debug("[Bedrock] Formatted {} turns for {} ({})", turns.size(), modelId, family);
        return new ProviderEnvelope(modelId, family, body);
    }
}
