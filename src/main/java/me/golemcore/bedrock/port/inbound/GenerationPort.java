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

package me.golemcore.bedrock.port.inbound;

import me.golemcore.bedrock.domain.model.GenerationOutcome;
import me.golemcore.bedrock.domain.model.GenerationRequest;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port used by the agent loop to obtain one model turn.
 */
public interface GenerationPort {

    /**
     * Produce an interpreted model answer, or a terminal response when the
     * conversation is looping. Fails with
     * {@link me.golemcore.bedrock.domain.model.GenerationFailedException} on bad
     * input or an exhausted retry budget. Cancelling the returned future stops
     * pending retries.
     */
    CompletableFuture<GenerationOutcome> generate(GenerationRequest request);

    /**
     * Same as {@link #generate} but delivered as a stream. Bedrock invoke is not
     * streaming, so the whole text arrives as a single element.
     */
    Flux<String> generateStream(GenerationRequest request);
}
