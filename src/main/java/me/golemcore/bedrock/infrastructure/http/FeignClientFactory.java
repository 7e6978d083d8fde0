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

package me.golemcore.bedrock.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.codec.ErrorDecoder;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import me.golemcore.bedrock.infrastructure.config.BedrockProperties;
import okhttp3.ConnectionPool;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Factory for creating Feign HTTP clients with OkHttp transport and Jackson
 * JSON encoding.
 *
 * <p>
 * Every client runs on its own connection pool over the shared
 * {@link okhttp3.OkHttpClient} (interceptors and timeouts are inherited), so
 * building a new client is how a connection is refreshed: sockets of the old
 * pool are never reused by the new one. The caller owns the pool and evicts it
 * once the client is replaced.
 *
 * <p>
 * Feign's own retryer is disabled; one call is one HTTP round trip.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * ConnectionPool pool = factory.newConnectionPool();
 * MyApi client = factory.create(MyApi.class, "https://api.example.com", new MyErrorDecoder(), pool);
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final BedrockProperties properties;

    public ConnectionPool newConnectionPool() {
        BedrockProperties.HttpProperties http = properties.getHttp();
        return new ConnectionPool(http.getMaxIdleConnections(), http.getKeepAliveDuration(), TimeUnit.MILLISECONDS);
    }

    /**
     * Create a Feign client for the given API interface on the given connection
     * pool.
     */
    public <T> T create(Class<T> apiType, String baseUrl, ErrorDecoder errorDecoder, ConnectionPool connectionPool) {
        BedrockProperties.HttpProperties http = properties.getHttp();
        okhttp3.OkHttpClient isolated = okHttpClient.newBuilder()
                .connectionPool(connectionPool)
                .retryOnConnectionFailure(false)
                .build();

        return Feign.builder()
                .client(new OkHttpClient(isolated))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .errorDecoder(errorDecoder)
                .retryer(Retryer.NEVER_RETRY)
                .options(new Request.Options(
                        http.getConnectTimeout(), TimeUnit.MILLISECONDS,
                        http.getReadTimeout(), TimeUnit.MILLISECONDS,
                        true))
                .target(apiType, baseUrl);
    }
}
