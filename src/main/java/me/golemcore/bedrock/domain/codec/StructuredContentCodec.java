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
import me.golemcore.bedrock.domain.model.TurnRole;

import java.util.List;

/**
 * Amazon Nova messages format.
 *
 * <pre>{@code
 * {"messages": [{"role": "user", "content": [{"text": "..."}]}],
 *  "inferenceConfig": {"maxTokens": 4096, "temperature": 0.7}}
 * }</pre>
 *
 * Nova has no system slot, so system text becomes one leading user turn.
 * Text is read from {@code output.message.content[0].text}.
 */
public class StructuredContentCodec implements ProviderCodec {

    @Override
    public ObjectNode format(List<ConversationTurn> turns, String systemText, int maxTokens, double temperature,
            ObjectMapper objectMapper) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode messages = body.putArray("messages");

        if (systemText != null && !systemText.isEmpty()) {
            appendMessage(messages, TurnRole.USER, systemText);
        }
        for (ConversationTurn turn : turns) {
            appendMessage(messages, turn.role(), turn.content());
        }

        ObjectNode inferenceConfig = body.putObject("inferenceConfig");
        inferenceConfig.put("maxTokens", maxTokens);
        inferenceConfig.put("temperature", temperature);
        return body;
    }

    private void appendMessage(ArrayNode messages, TurnRole role, String text) {
        ObjectNode message = messages.addObject();
        message.put("role", role.wireName());
        message.putArray("content").addObject().put("text", text);
    }

    @Override
    public String extract(JsonNode response) {
        JsonNode text = response.path("output").path("message").path("content").path(0).path("text");
        if (!text.isTextual()) {
            throw new MalformedResponseException("Nova response has no output.message.content[0].text");
        }
        return text.asText();
    }
}
