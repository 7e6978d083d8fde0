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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bedrock.domain.codec.ProviderCodecs;
import me.golemcore.bedrock.domain.model.MalformedResponseException;
import me.golemcore.bedrock.domain.model.ProviderFamily;
import org.springframework.stereotype.Service;

/**
 * Reads the generated text out of a provider response. A response without the
 * family's text path is returned stringified instead of failing the request.
 */
@Service
@Slf4j
public class ResponseExtractor {

    public String extract(JsonNode response, ProviderFamily family) {
        if (response == null || response.isNull()) {
            return "";
        }
        if (family == null) {
            return stringify(response);
        }
        try {
            return ProviderCodecs.forFamily(family).extract(response);
        } catch (MalformedResponseException e) {
            log.warn("[Bedrock] {}, returning raw payload", e.getMessage());
            return stringify(response);
        }
    }

    private static String stringify(JsonNode response) {
        return response.isTextual() ? response.asText() : response.toString();
    }
}
