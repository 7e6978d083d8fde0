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

package me.golemcore.bedrock.adapter.outbound.bedrock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import feign.Headers;
import feign.Param;
import feign.RequestLine;

/**
 * Bedrock runtime InvokeModel API, authenticated with a Bedrock API key.
 */
public interface BedrockRuntimeApi {

    @RequestLine("POST /model/{modelId}/invoke")
    @Headers({
            "Content-Type: application/json",
            "Accept: application/json",
            "Authorization: Bearer {apiKey}"
    })
    JsonNode invokeModel(@Param("apiKey") String apiKey, @Param("modelId") String modelId, ObjectNode body);
}
