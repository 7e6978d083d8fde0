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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of a single generation: conversation history plus generation
 * parameters. Built per call and never persisted.
 */
@Data
@Builder
public class GenerationRequest {

    @Builder.Default
    private List<ConversationTurn> messages = new ArrayList<>();

    /**
     * Upper bound of generated tokens. Null means the model catalog default.
     */
    private Integer maxTokens;

    /**
     * Sampling temperature in [0, 1]. Null means the model catalog default.
     */
    private Double temperature;

    private String systemPrompt;

    @Builder.Default
    private List<ToolDescriptor> toolCatalog = new ArrayList<>();

}
