package me.golemcore.bedrock.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProviderFamilyTest {

    @Test
    void shouldResolveFamilyFromModelId() {
        assertEquals(Optional.of(ProviderFamily.STRUCTURED_CONTENT),
                ProviderFamily.fromModelId("amazon.nova-pro-v1:0"));
        assertEquals(Optional.of(ProviderFamily.FLAT_TEXT),
                ProviderFamily.fromModelId("anthropic.claude-3-haiku-20240307-v1:0"));
        assertEquals(Optional.of(ProviderFamily.FLAT_TEXT),
                ProviderFamily.fromModelId("us.anthropic.CLAUDE-3-7-sonnet"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "amazon.titan-text-express-v1", "meta.llama3-70b-instruct-v1:0", "  " })
    void shouldNotResolveUnsupportedModels(String modelId) {
        assertTrue(ProviderFamily.fromModelId(modelId).isEmpty());
    }

    @Test
    void shouldParseRoleWireNames() {
        assertEquals(TurnRole.ASSISTANT, TurnRole.fromWireName("Assistant"));
        assertEquals("user", TurnRole.USER.wireName());
        assertThrows(IllegalArgumentException.class, () -> TurnRole.fromWireName("tool"));
        assertThrows(IllegalArgumentException.class, () -> TurnRole.fromWireName(null));
    }

    @Test
    void shouldNormalizeNullContent() {
        ConversationTurn turn = new ConversationTurn(TurnRole.USER, null);

        assertEquals("", turn.content());
        assertEquals("build html page", ConversationTurn.user("Build HTML Page").normalizedContent());
        assertThrows(NullPointerException.class, () -> new ConversationTurn(null, "x"));
    }
}
