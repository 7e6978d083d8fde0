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

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Provider-specific request payload. Built by the request formatter and only
 * read by the invocation client.
 *
 * @param modelId
 *            resolved provider model identifier
 * @param family
 *            wire family the body was built for
 * @param body
 *            JSON request body
 */
public record ProviderEnvelope(String modelId, ProviderFamily family, ObjectNode body) {
}
