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

import lombok.RequiredArgsConstructor;
import me.golemcore.bedrock.domain.model.ToolDescriptor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Appends the tool catalog and the JSON tool-call format to the system
 * prompt, so the model knows which calls the parser will recognize.
 */
@Service
@RequiredArgsConstructor
public class ToolInstructionComposer {

    static final String TEMPLATE_RESOURCE = "prompts/tool-instructions.md";

    private static final String DEFAULT_TEMPLATE = """
            AVAILABLE TOOLS:
            {{tools}}

            TOOL USAGE INSTRUCTIONS:
            When you need to use a tool, format your response as JSON like this:
            {"name": "tool_name", "arguments": {"param1": "value1"}}

            CRITICAL RULES:
            - Use web_search ONLY ONCE per task
            - After getting search results, NEVER search again
            """;

    private final PromptTemplateEngine templateEngine;

    private volatile String template;

    /**
     * Effective system prompt for a request.
     *
     * @return the prompt unchanged when there are no tools, otherwise the prompt
     *         followed by the rendered tool block
     */
    public String compose(String systemPrompt, List<ToolDescriptor> tools) {
        if (tools == null || tools.isEmpty()) {
            return systemPrompt;
        }
        String toolList = tools.stream()
                .map(tool -> "- " + tool.name() + ": " + tool.description())
                .collect(Collectors.joining("\n"));
        String block = templateEngine.render(template(), Map.of("tools", toolList)).strip();

        if (systemPrompt == null || systemPrompt.isBlank()) {
            return block;
        }
        return systemPrompt + "\n\n" + block;
    }

    private String template() {
        String loaded = template;
        if (loaded == null) {
            loaded = PromptResources.load(TEMPLATE_RESOURCE, DEFAULT_TEMPLATE);
            template = loaded;
        }
        return loaded;
    }
}
