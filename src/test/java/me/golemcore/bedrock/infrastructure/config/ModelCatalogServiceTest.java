package me.golemcore.bedrock.infrastructure.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelCatalogServiceTest {

    private ModelCatalogService service;

    @BeforeEach
    void setUp() {
        service = new ModelCatalogService();
        service.init();
    }

    @ParameterizedTest
    @CsvSource({
            "nova-pro, amazon.nova-pro-v1:0",
            "nova, amazon.nova-pro-v1:0",
            "claude, anthropic.claude-3-7-sonnet-20250219-v1:0",
            "claude-3.5, anthropic.claude-3-5-sonnet-20240620-v1:0",
            "claude-fast, anthropic.claude-3-haiku-20240307-v1:0",
            "titan, amazon.titan-text-express-v1",
            "meta.llama3-70b-instruct-v1:0, meta.llama3-70b-instruct-v1:0",
            "my-custom-model, my-custom-model"
    })
    void shouldResolveModelIds(String name, String expected) {
        assertEquals(expected, service.resolveModelId(name));
    }

    @Test
    void shouldResolveNullToDefaultModel() {
        assertEquals("nova-pro", service.getDefaultModel());
        assertEquals("amazon.nova-pro-v1:0", service.resolveModelId(null));
    }

    @Test
    void shouldExposeGenerationDefaults() {
        assertEquals(4096, service.getDefaultMaxTokens("claude-fast"));
        assertEquals(0.7, service.getDefaultTemperature("nova-micro"));
        assertEquals(4096, service.getDefaultMaxTokens("unknown"));
        // embedding model has no generation budget
        assertEquals(4096, service.getDefaultMaxTokens("titan-embeddings"));
        assertFalse(service.getModel("titan").isSupportsSystemMessages());
    }

    @Test
    void shouldListAndFilterModels() {
        Map<String, ModelCatalogService.ModelSettings> models = service.listModels();

        assertEquals(9, models.size());
        assertEquals(4, service.getModelsByProvider("anthropic").size());
        assertEquals(5, service.getModelsByProvider("amazon").size());
        assertTrue(service.getModelsByProvider("cohere").isEmpty());
    }

    @Test
    void shouldEstimateCost() {
        assertEquals(0.004, service.estimateCost("nova-pro", 1000, 1000), 1e-9);
        assertEquals(0.0105, service.estimateCost("claude", 1000, 500), 1e-9);
    }

    @Test
    void shouldListAvailableNamesForUnknownModel() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> service.getModel("gpt-4o"));

        assertTrue(exception.getMessage().contains("gpt-4o"));
        assertTrue(exception.getMessage().contains("nova-pro"));
        assertTrue(exception.getMessage().contains("claude-fast"));
    }

    @Test
    void shouldUseFallbackTableWhenNameIsNotInCatalog() {
        ModelCatalogService fallbackOnly = new ModelCatalogService("catalog/fallback-only.json");
        fallbackOnly.init();

        assertEquals("amazon.nova-lite-v1:0", fallbackOnly.resolveModelId("nova-lite"));
        assertEquals("amazon.nova-lite-v1:0", fallbackOnly.resolveModelId(null));
        assertEquals("anthropic.claude-3-haiku-20240307-v1:0", fallbackOnly.resolveModelId("claude-3-haiku"));
        assertEquals("amazon.nova-micro-v1:0", fallbackOnly.resolveModelId("amazon.nova-micro-v1:0"));
        assertEquals("nova-micro", fallbackOnly.resolveModelId("nova-micro"));
    }

    @Test
    void shouldStartWithEmptyCatalogWhenResourceIsMissing() {
        ModelCatalogService missing = new ModelCatalogService("does-not-exist.json");
        missing.init();

        assertTrue(missing.listModels().isEmpty());
        assertEquals(ModelCatalogService.DEFAULT_MODEL, missing.getDefaultModel());
        assertEquals("nova-pro", missing.resolveModelId("nova-pro"));
    }
}
