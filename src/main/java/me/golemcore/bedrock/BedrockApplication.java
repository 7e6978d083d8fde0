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

package me.golemcore.bedrock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Bedrock.
 *
 * <p>
 * GolemCore Bedrock turns a raw call to an AWS Bedrock model into a reliable,
 * structured agent turn.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Two model families</b> - Amazon Nova (structured content) and
 * Anthropic Claude (flat text) request/response codecs</li>
 * <li><b>Resilient invocation</b> - bounded randomized backoff with connection
 * refresh on throttling</li>
 * <li><b>Tool-call recovery</b> - JSON tool calls parsed out of free-form
 * text</li>
 * <li><b>Loop guard</b> - stops repeated searching/planning with a final
 * answer</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Inbound port       → GenerationPort
 * Domain Layer       → InvocationOrchestrator, LoopGuard, ToolCallParser, codecs
 * Outbound adapter   → BedrockInvocationClient (Feign + OkHttp)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code bedrock.*} prefix; the model catalog lives in {@code models.json}.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BedrockApplication {

    public static void main(String[] args) {
        SpringApplication.run(BedrockApplication.class, args);
    }

}
