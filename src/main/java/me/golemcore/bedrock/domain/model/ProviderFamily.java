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
import java.util.Optional;

/**
 * Wire-shape family of a Bedrock model. The two families are mutually
 * exclusive: a request body built for one is rejected by the other.
 */
public enum ProviderFamily {

    /**
     * Amazon Nova: content is an array of typed parts, system text travels as a
     * leading user turn.
     */
    STRUCTURED_CONTENT,

    /**
     * Anthropic Claude: content is a single string, system text has its own slot.
     */
    FLAT_TEXT;

    /**
     * Resolve the family from a provider model identifier such as
     * {@code amazon.nova-pro-v1:0} or {@code anthropic.claude-3-haiku-20240307-v1:0}.
     */
    public static Optional<ProviderFamily> fromModelId(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return Optional.empty();
        }
        String normalized = modelId.toLowerCase(Locale.ROOT);
        if (normalized.contains("claude")) {
            return Optional.of(FLAT_TEXT);
        }
        if (normalized.contains("nova")) {
            return Optional.of(STRUCTURED_CONTENT);
        }
        return Optional.empty();
    }
}
