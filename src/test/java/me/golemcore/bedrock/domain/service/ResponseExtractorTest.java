package me.golemcore.bedrock.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.bedrock.domain.model.ProviderFamily;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseExtractor extractor = new ResponseExtractor();

    @Test
    void shouldExtractNovaText() throws Exception {
        JsonNode response = objectMapper.readTree("""
                {"output": {"message": {"role": "assistant",
                  "content": [{"text": "First part"}, {"text": "Second part"}]}},
                 "stopReason": "end_turn"}
                """);

        assertEquals("First part", extractor.extract(response, ProviderFamily.STRUCTURED_CONTENT));
    }

    @Test
    void shouldExtractClaudeText() throws Exception {
        JsonNode response = objectMapper.readTree("""
                {"id": "msg_1", "type": "message", "role": "assistant",
                 "content": [{"type": "text", "text": "Hello from Claude"}]}
                """);

        assertEquals("Hello from Claude", extractor.extract(response, ProviderFamily.FLAT_TEXT));
    }

    @Test
    void shouldFallBackToRawPayloadWhenPathIsMissing() throws Exception {
        JsonNode response = objectMapper.readTree("{\"results\":[{\"outputText\":\"titan\"}]}");

        assertEquals(response.toString(), extractor.extract(response, ProviderFamily.FLAT_TEXT));
        assertEquals(response.toString(), extractor.extract(response, ProviderFamily.STRUCTURED_CONTENT));
    }

    @Test
    void shouldFallBackToRawPayloadForUnknownFamily() throws Exception {
        JsonNode response = objectMapper.readTree("{\"content\":[{\"text\":\"ignored\"}]}");

        assertEquals(response.toString(), extractor.extract(response, null));
    }

    @Test
    void shouldReturnTextualPayloadAsIs() {
        assertEquals("plain", extractor.extract(objectMapper.getNodeFactory().textNode("plain"),
                ProviderFamily.FLAT_TEXT));
        assertEquals("", extractor.extract(null, ProviderFamily.FLAT_TEXT));
    }
}
