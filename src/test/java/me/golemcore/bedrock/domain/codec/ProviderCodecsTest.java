package me.golemcore.bedrock.domain.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.bedrock.domain.model.ConversationTurn;
import me.golemcore.bedrock.domain.model.MalformedResponseException;
import me.golemcore.bedrock.domain.model.ProviderFamily;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProviderCodecsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldMapEachFamilyToItsCodec() {
        assertInstanceOf(StructuredContentCodec.class, ProviderCodecs.forFamily(ProviderFamily.STRUCTURED_CONTENT));
        assertInstanceOf(FlatTextCodec.class, ProviderCodecs.forFamily(ProviderFamily.FLAT_TEXT));
        assertSame(ProviderCodecs.forFamily(ProviderFamily.FLAT_TEXT),
                ProviderCodecs.forFamily(ProviderFamily.FLAT_TEXT));
    }

    @Test
    void shouldOmitSystemSlotWhenClaudeHasNoSystemText() {
        ObjectNode body = ProviderCodecs.forFamily(ProviderFamily.FLAT_TEXT)
                .format(List.of(ConversationTurn.user("hi")), null, 100, 0.2, objectMapper);

        assertFalse(body.has("system"));
        assertEquals(FlatTextCodec.ANTHROPIC_VERSION, body.get("anthropic_version").asText());
        assertEquals("hi", body.path("messages").path(0).path("content").asText());
    }

    @Test
    void shouldRejectResponseShapedForOtherFamily() {
        ObjectNode claudeShaped = objectMapper.createObjectNode();
        claudeShaped.putArray("content").addObject().put("text", "hello");

        assertEquals("hello", ProviderCodecs.forFamily(ProviderFamily.FLAT_TEXT).extract(claudeShaped));
        assertThrows(MalformedResponseException.class,
                () -> ProviderCodecs.forFamily(ProviderFamily.STRUCTURED_CONTENT).extract(claudeShaped));
    }
}
