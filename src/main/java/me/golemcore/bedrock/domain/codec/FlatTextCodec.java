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

package me.golemcore.bedrock.domain.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.bedrock.domain.model.ConversationTurn;
import me.golemcore.bedrock.domain.model.MalformedResponseException;

import java.util.List;

/**
 * Anthropic Claude messages format on Bedrock. Content is a plain string and
 * system text goes into the top-level {@code system} field.
 */
public class FlatTextCodec implements ProviderCodec {

    static final String ANTHROPIC_VERSION = "bedrock-2023-05-31";

    @Override
    public ObjectNode format(List<ConversationTurn> turns, String systemText, int maxTokens, double temperature,
            ObjectMapper objectMapper) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("anthropic_version", ANTHROPIC_VERSION);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        if (systemText != null && !systemText.isEmpty()) {
            body.put("system", systemText);
        }

        ArrayNode messages = body.putArray("messages");
        for (ConversationTurn turn : turns) {
            ObjectNode message = messages.addObject();
            message.put("role", turn.role().wireName());
            message.put("content", turn.content());
        }
        return body;
    }

    @Override
    public String extract(JsonNode response) {
        JsonNode text = response.path("content").path(0).path("text");
        if (!text.isTextual()) {
            throw new MalformedResponseException("Claude response has no content[0].text");
        }
        return text.asText();
    }
}
