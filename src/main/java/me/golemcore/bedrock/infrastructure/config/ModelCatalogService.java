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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Static catalog of Bedrock models loaded from {@code classpath:models.json}.
 *
 * <p>
 * Maps logical names and aliases (e.g. {@code nova}, {@code claude-3.5}) to
 * provider model ids and generation defaults. Resolution of a name that is not
 * in the catalog falls back to:
 * <ol>
 * <li>the name itself when it already carries a provider prefix
 * ({@code amazon.}, {@code anthropic.}, ...)</li>
 * <li>the {@code fallbacks} table</li>
 * <li>the name verbatim</li>
 * </ol>
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ModelCatalogService {

    public static final String DEFAULT_MODEL = "nova-pro";

    private static final String CONFIG_FILE = "models.json";
    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final double DEFAULT_TEMPERATURE = 0.7;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String resourceName;
    private ModelsConfig config = new ModelsConfig();

    public ModelCatalogService() {
        this(CONFIG_FILE);
    }

    // Visible for testing
    ModelCatalogService(String resourceName) {
        this.resourceName = resourceName;
    }

    @PostConstruct
    public void init() {
        loadConfig();
    }

    private void loadConfig() {
        try {
            ClassPathResource resource = new ClassPathResource(resourceName);
            if (resource.exists()) {
                try (InputStream is = resource.getInputStream()) {
                    String json = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                    config = objectMapper.readValue(json, ModelsConfig.class);
                    log.info("[ModelCatalog] Loaded from classpath: {} models, {} aliases",
                            config.getModels().size(), config.getAliases().size());
                    return;
                }
            }
        } catch (IOException e) {
            log.warn("[ModelCatalog] Failed to load {}: {}", resourceName, e.getMessage());
        }

        log.warn("[ModelCatalog] No {} found, using empty catalog", resourceName);
        config = new ModelsConfig();
    }

    /**
     * Reload the catalog from the classpath.
     */
    public void reload() {
        loadConfig();
    }

    public String getDefaultModel() {
        return config.getDefaultModel() != null ? config.getDefaultModel() : DEFAULT_MODEL;
    }

    /**
     * Get settings for a logical name or alias.
     *
     * @throws IllegalArgumentException
     *             if neither the name nor its alias target is in the catalog
     */
    public ModelSettings getModel(String name) {
        return findModel(name).orElseThrow(() -> new IllegalArgumentException(
                "Model '" + name + "' not found. Available models: " + availableNames()));
    }

    public Optional<ModelSettings> findModel(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String resolved = config.getAliases().getOrDefault(name, name);
        return Optional.ofNullable(config.getModels().get(resolved));
    }

    /**
     * Resolve a logical name, alias or provider id to the provider model id.
     */
    public String resolveModelId(String name) {
        Optional<ModelSettings> settings = findModel(name);
        if (settings.isPresent()) {
            return settings.get().getModelId();
        }
        if (name == null) {
            return resolveModelId(getDefaultModel());
        }
        if (hasProviderPrefix(name)) {
            return name;
        }
        String fallback = config.getFallbacks().get(name);
        if (fallback != null) {
            log.debug("[ModelCatalog] Resolved '{}' through fallback table: {}", name, fallback);
            return fallback;
        }
        log.warn("[ModelCatalog] Unknown model '{}', using it verbatim", name);
        return name;
    }

    private boolean hasProviderPrefix(String name) {
        return config.getProviderPrefixes().stream().anyMatch(name::startsWith);
    }

    public int getDefaultMaxTokens(String name) {
        return findModel(name)
                .map(ModelSettings::getMaxTokens)
                .filter(tokens -> tokens > 0)
                .orElse(DEFAULT_MAX_TOKENS);
    }

    public double getDefaultTemperature(String name) {
        return findModel(name)
                .map(ModelSettings::getTemperature)
                .orElse(DEFAULT_TEMPERATURE);
    }

    /**
     * Get all model configurations, keyed by logical name.
     */
    public Map<String, ModelSettings> listModels() {
        return new LinkedHashMap<>(config.getModels());
    }

    /**
     * Get models served by one provider ("anthropic", "amazon").
     */
    public Map<String, ModelSettings> getModelsByProvider(String provider) {
        return config.getModels().entrySet().stream()
                .filter(entry -> entry.getValue().getProvider().equals(provider))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    /**
     * Estimated cost in USD of one call.
     */
    public double estimateCost(String name, int inputTokens, int outputTokens) {
        ModelSettings settings = getModel(name);
        double inputCost = inputTokens / 1000.0 * settings.getCostPer1kInputTokens();
        double outputCost = outputTokens / 1000.0 * settings.getCostPer1kOutputTokens();
        return inputCost + outputCost;
    }

    private List<String> availableNames() {
        List<String> names = new ArrayList<>(config.getModels().keySet());
        names.addAll(config.getAliases().keySet());
        return names;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsConfig {
        private String defaultModel = DEFAULT_MODEL;
        private Map<String, ModelSettings> models = new LinkedHashMap<>();
        private Map<String, String> aliases = new LinkedHashMap<>();
        private List<String> providerPrefixes = new ArrayList<>();
        private Map<String, String> fallbacks = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelSettings {
        private String modelId;
        private String displayName;
        private String provider = "amazon";
        private int maxTokens = DEFAULT_MAX_TOKENS;
        private double temperature = DEFAULT_TEMPERATURE;
        private boolean supportsSystemMessages = true;
        private boolean supportsStreaming;
        private double costPer1kInputTokens;
        private double costPer1kOutputTokens;
    }
}
