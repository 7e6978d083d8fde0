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
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bedrock.domain.model.PermanentProviderException;
import me.golemcore.bedrock.domain.model.ProviderEnvelope;
import me.golemcore.bedrock.domain.model.ProviderException;
import me.golemcore.bedrock.domain.system.ProviderErrorClassifier;
import me.golemcore.bedrock.infrastructure.config.BedrockProperties;
import me.golemcore.bedrock.infrastructure.config.ModelCatalogService;
import me.golemcore.bedrock.infrastructure.http.FeignClientFactory;
import me.golemcore.bedrock.port.outbound.ModelInvocationPort;
import okhttp3.ConnectionPool;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Invokes Bedrock models over the runtime REST API using Feign + OkHttp.
 *
 * <p>
 * Retry policy per {@link #invoke} call:
 * <ul>
 * <li>at most {@code bedrock.retry.max-attempts} (3) HTTP round trips</li>
 * <li>before retry {@code n + 1} a random wait in
 * {@code [0, min(60, 2^(n-1))]} backoff units</li>
 * <li>after a throttling or service-unavailable failure the connection is
 * refreshed first: the refresh count goes up by one, the client waits
 * {@code 2^count} delay units and rebuilds the Feign client on a new
 * connection pool, evicting the idle sockets of the old one</li>
 * <li>once the refresh count reaches {@code bedrock.reconnect.max-attempts}
 * (5) no refresh is granted and the failure is returned without further
 * retries</li>
 * </ul>
 * A successful call resets the refresh count. The count is owned by this
 * instance and shared by all its concurrent requests.
 *
 * <p>
 * Waits are scheduled with {@link CompletableFuture#delayedExecutor}; no
 * thread sleeps. Cancelling the returned future stops the sequence before the
 * next round trip.
 *
 * <p>
 * Lazy initialization: the client connects on first use and only when an API
 * key is configured.
 */
@Component
@Slf4j
public class BedrockInvocationClient implements ModelInvocationPort {

    private static final String PROVIDER_ID = "bedrock";

    private final BedrockProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final ObjectMapper objectMapper;
    private final ModelCatalogService modelCatalog;
    private final ConnectionState connectionState;

    private final Executor executor = ForkJoinPool.commonPool();
    private volatile BedrockRuntimeApi api;
    private volatile ConnectionPool connectionPool;
    private volatile boolean initialized = false;

    public BedrockInvocationClient(BedrockProperties properties, FeignClientFactory feignClientFactory,
            ObjectMapper objectMapper, ModelCatalogService modelCatalog) {
        this.properties = properties;
        this.feignClientFactory = feignClientFactory;
        this.objectMapper = objectMapper;
        this.modelCatalog = modelCatalog;
        this.connectionState = new ConnectionState(properties.getReconnect().getMaxAttempts());
    }

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        if (!isAvailable()) {
            log.warn("[Bedrock] API key not configured, client not initialized");
            return;
        }
        try {
            connect();
            connectionState.reset();
            initialized = true;
            log.info("[Bedrock] Client initialized: model {} at {}",
                    modelCatalog.resolveModelId(properties.getModel()), properties.resolveEndpoint());
        } catch (RuntimeException e) {
            log.warn("[Bedrock] Failed to initialize client: {}", e.getMessage());
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    public ConnectionState getConnectionState() {
        return connectionState;
    }

    @Override
    public CompletableFuture<JsonNode> invoke(ProviderEnvelope envelope) {
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        ensureInitialized();
        if (api == null) {
            String code = ProviderErrorClassifier.NOT_CONFIGURED;
            result.completeExceptionally(new PermanentProviderException(code, 0,
                    ProviderErrorClassifier.withCode(code, "Bedrock client is not configured")));
            return result;
        }
        schedule(() -> attempt(envelope, 1, result), 0, result);
        return result;
    }

    private void attempt(ProviderEnvelope envelope, int attempt, CompletableFuture<JsonNode> result) {
        if (result.isDone()) {
            log.debug("[Bedrock] Request completed or cancelled, skipping attempt {}", attempt);
            return;
        }
        BedrockRuntimeApi current = api;
        log.debug("[Bedrock] Invoking {} (attempt {}/{})", envelope.modelId(), attempt, maxAttempts());

        JsonNode response;
        try {
            response = current.invokeModel(properties.getApiKey(), envelope.modelId(), envelope.body());
        } catch (RuntimeException e) {
            onFailure(envelope, attempt, result, toProviderException(e));
            return;
        }
        connectionState.reset();
        result.complete(response);
    }

    private void onFailure(ProviderEnvelope envelope, int attempt, CompletableFuture<JsonNode> result,
            ProviderException failure) {
        if (!failure.isTransient()) {
            retryOrFail(envelope, attempt, result, failure);
            return;
        }

        int refreshCount = connectionState.tryBeginRefresh();
        if (refreshCount < 0) {
            log.warn("[Bedrock] Reconnect limit reached ({}/{}), giving up: {}",
                    connectionState.getAttemptCount(), connectionState.getMaxAttempts(), failure.getMessage());
            result.completeExceptionally(failure);
            return;
        }
        long delay = properties.getReconnect().getDelayUnit().toMillis() * (1L << refreshCount);
        log.warn("[Bedrock] {} on attempt {}/{}, reconnecting ({}/{}) in {} ms", failure.getCode(), attempt,
                maxAttempts(), refreshCount, connectionState.getMaxAttempts(), delay);
        schedule(() -> {
            if (result.isDone()) {
                return;
            }
            refreshConnection();
            retryOrFail(envelope, attempt, result, failure);
        }, delay, result);
    }

    private void retryOrFail(ProviderEnvelope envelope, int attempt, CompletableFuture<JsonNode> result,
            ProviderException failure) {
        if (attempt >= maxAttempts()) {
            log.warn("[Bedrock] Giving up after {} attempts: {}", attempt, failure.getMessage());
            result.completeExceptionally(failure);
            return;
        }
        long backoff = backoffMillis(attempt);
        log.warn("[Bedrock] Attempt {}/{} failed ({}), retrying in {} ms", attempt, maxAttempts(),
                failure.getMessage(), backoff);
        schedule(() -> attempt(envelope, attempt + 1, result), backoff, result);
    }

    private synchronized void refreshConnection() {
        connect();
        log.info("[Bedrock] Connection rebuilt");
    }

    private synchronized void connect() {
        ConnectionPool previous = connectionPool;
        ConnectionPool pool = feignClientFactory.newConnectionPool();
        api = feignClientFactory.create(BedrockRuntimeApi.class, properties.resolveEndpoint(),
                new BedrockErrorDecoder(objectMapper), pool);
        connectionPool = pool;
        if (previous != null) {
            previous.evictAll();
        }
    }

    // Visible for testing
    ConnectionPool getConnectionPool() {
        return connectionPool;
    }

    /**
     * Random wait after failed attempt {@code n}, uniform in
     * {@code [0, min(max, multiplier * 2^(n-1))]} units.
     */
    private long backoffMillis(int failedAttempt) {
        BedrockProperties.RetryProperties retry = properties.getRetry();
        double ceiling = Math.min(retry.getMaxBackoffUnits(),
                retry.getBackoffMultiplier() * Math.pow(2, failedAttempt - 1));
        double units = ThreadLocalRandom.current().nextDouble() * ceiling;
        return (long) (units * retry.getBackoffUnit().toMillis());
    }

    private int maxAttempts() {
        return properties.getRetry().getMaxAttempts();
    }

    private void schedule(Runnable task, long delayMillis, CompletableFuture<JsonNode> result) {
        Executor target = delayMillis > 0
                ? CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS, executor)
                : executor;
        CompletableFuture.runAsync(task, target).exceptionally(error -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            result.completeExceptionally(cause);
            return null;
        });
    }

    private static ProviderException toProviderException(RuntimeException e) {
        if (e instanceof ProviderException providerException) {
            return providerException;
        }
        String code = ProviderErrorClassifier.classifyFromThrowable(e);
        int status = e instanceof FeignException feignException ? Math.max(feignException.status(), 0) : 0;
        return new PermanentProviderException(code, status, ProviderErrorClassifier.withCode(code, e.getMessage()),
                e);
    }
}
