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

package me.golemcore.bedrock.port.outbound;

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.bedrock.domain.model.ProviderEnvelope;

import java.util.concurrent.CompletableFuture;

/**
 * Port for sending a formatted request to the model runtime.
 */
public interface ModelInvocationPort {

    /**
     * Returns the provider identifier (e.g., "bedrock").
     */
    String getProviderId();

    /**
     * Send the envelope and return the raw response body. Retries and
     * connection refreshes happen inside; the future fails with a
     * {@link me.golemcore.bedrock.domain.model.ProviderException} once they are
     * exhausted.
     */
    CompletableFuture<JsonNode> invoke(ProviderEnvelope envelope);

    /**
     * Checks if the runtime is configured (credentials present).
     */
    boolean isAvailable();
}
