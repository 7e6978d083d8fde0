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
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.bedrock.domain.model.ConversationTurn;
import me.golemcore.bedrock.domain.model.MalformedResponseException;

import java.util.List;

/**
 * Wire codec of one provider family: builds the request body and reads the
 * generated text back out of the response body.
 */
public interface ProviderCodec {

    /**
     * Build the request body.
     *
     * @param turns
     *            non-system turns in conversation order
     * @param systemText
     *            all system text already joined into one slot, or null
     */
    ObjectNode format(List<ConversationTurn> turns, String systemText, int maxTokens, double temperature,
            ObjectMapper objectMapper);

    /**
     * Read the generated text.
     *
     * @throws MalformedResponseException
     *             if the family's text path is absent
     */
    String extract(JsonNode response);
}
