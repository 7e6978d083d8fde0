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
package me.golemcore.bedrock.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties bound from application.properties under the
 * {@code bedrock.*} prefix.
 *
 * <p>
 * Nested groups:
 * <ul>
 * <li>{@link RetryProperties} - attempt envelope and randomized backoff</li>
 * <li>{@link ReconnectProperties} - connection refresh on throttling</li>
 * <li>{@link HttpProperties} - OkHttp timeouts and pool</li>
 * <li>{@link LoopGuardProperties} - repetition window and thresholds</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bedrock")
@Data
public class BedrockProperties {

    private String region = "us-east-1";
    private String apiKey;

    /**
     * Runtime endpoint override. Blank means
     * {@code https://bedrock-runtime.<region>.amazonaws.com}.
     */
    private String endpoint;

    /**
     * Logical model name or provider model id.
     */
    private String model = ModelCatalogService.DEFAULT_MODEL;

    /**
     * Default max tokens; null falls back to the model catalog entry.
     */
    private Integer maxTokens;

    /**
     * Default temperature; null falls back to the model catalog entry.
     */
    private Double temperature;

    private RetryProperties retry = new RetryProperties();
    private ReconnectProperties reconnect = new ReconnectProperties();
    private HttpProperties http = new HttpProperties();
    private LoopGuardProperties loopGuard = new LoopGuardProperties();

    public String resolveEndpoint() {
        if (endpoint != null && !endpoint.isBlank()) {
            return endpoint;
        }
        return "https://bedrock-runtime." + region + ".amazonaws.com";
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        /**
         * One backoff time-unit. Waits are multiples of this value.
         */
        private Duration backoffUnit = Duration.ofSeconds(1);
        private double backoffMultiplier = 1.0;
        /**
         * Cap of the randomized exponential wait, in time-units.
         */
        private long maxBackoffUnits = 60;
    }

    @Data
    public static class ReconnectProperties {
        private int maxAttempts = 5;
        /**
         * Unit of the {@code 2^attempt} wait before rebuilding the connection.
         */
        private Duration delayUnit = Duration.ofSeconds(1);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 50;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class LoopGuardProperties {
        private boolean enabled = true;
        private int window = 5;
        private int minHistory = 3;
        private int searchThreshold = 2;
        private int planningThreshold = 3;
        private String terminalResponseTemplate = "prompts/terminal-response.md";
    }
}
