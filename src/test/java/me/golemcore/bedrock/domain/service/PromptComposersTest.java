package me.golemcore.bedrock.domain.service;

import me.golemcore.bedrock.domain.model.ConversationTurn;
import me.golemcore.bedrock.domain.model.LoopAssessment;
import me.golemcore.bedrock.domain.model.TerminalResponse;
import me.golemcore.bedrock.domain.model.ToolDescriptor;
import me.golemcore.bedrock.infrastructure.config.BedrockProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptComposersTest {

    private static final List<ToolDescriptor> TOOLS = List.of(
            new ToolDescriptor("web_search", "Search the web"),
            new ToolDescriptor("write_file", "Write a file to disk"));

    private PromptTemplateEngine templateEngine;
    private ToolInstructionComposer toolInstructionComposer;
    private TerminalResponseComposer terminalResponseComposer;

    @BeforeEach
    void setUp() {
        templateEngine = new PromptTemplateEngine();
        toolInstructionComposer = new ToolInstructionComposer(templateEngine);
        terminalResponseComposer = new TerminalResponseComposer(new BedrockProperties(), templateEngine,
                new ToolCallParser());
    }

    @Test
    void shouldRenderKnownVariablesAndKeepUnknownOnes() {
        String rendered = templateEngine.render("Hi {{name}}, {{ missing }} and {{name}}",
                Map.of("name", "Ana"));

        assertEquals("Hi Ana, {{ missing }} and Ana", rendered);
        assertEquals("as is", templateEngine.render("as is", Map.of()));
        assertNull(templateEngine.render(null, Map.of("a", "b")));
    }

    @Test
    void shouldCountWords() {
        assertEquals(4, PromptTemplateEngine.countWords("  one two\nthree\tfour "));
        assertEquals(0, PromptTemplateEngine.countWords("   "));
        assertEquals(0, PromptTemplateEngine.countWords(null));
    }

    @Test
    void shouldAppendToolInstructionsToSystemPrompt() {
        String prompt = toolInstructionComposer.compose("You are helpful.", TOOLS);

        assertTrue(prompt.startsWith("You are helpful.\n\nAVAILABLE TOOLS:"));
        assertTrue(prompt.contains("- web_search: Search the web\n- write_file: Write a file to disk"));
        assertTrue(prompt.contains("TOOL USAGE INSTRUCTIONS:"));
        assertTrue(prompt.contains("Use web_search ONLY ONCE"));
    }

    @Test
    void shouldLeavePromptUntouchedWithoutTools() {
        assertEquals("You are helpful.", toolInstructionComposer.compose("You are helpful.", List.of()));
        assertNull(toolInstructionComposer.compose(null, null));
    }

    @Test
    void shouldUseToolBlockAloneWithoutSystemPrompt() {
        assertTrue(toolInstructionComposer.compose(null, TOOLS).startsWith("AVAILABLE TOOLS:"));
    }

    @Test
    void shouldWrapLatestAssistantFindingsInTerminalResponse() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("When does the call close?"),
                ConversationTurn.assistant("The call closes on 26 May 2025."),
                ConversationTurn.user("Search again"),
                ConversationTurn.assistant("{\"name\": \"web_search\", \"arguments\": {\"query\": \"deadline\"}}"));

        TerminalResponse response = terminalResponseComposer.compose(history, new LoopAssessment(2, 1, true, false));

        assertTrue(response.text().contains("The call closes on 26 May 2025."));
        assertTrue(response.text().contains("2 search step(s)"));
        assertTrue(response.text().contains("1 planning step(s)"));
        assertFalse(response.text().contains("{{"));
        assertEquals(2, response.searchCount());
        assertEquals(1, response.planningCount());
        assertEquals(PromptTemplateEngine.countWords(response.text()), response.usageEstimate());
    }

    @Test
    void shouldUsePlaceholderFindingsWithoutAssistantTurns() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("web_search this"),
                ConversationTurn.user("web_search that"),
                ConversationTurn.user("and more"));

        TerminalResponse response = terminalResponseComposer.compose(history, new LoopAssessment(2, 0, true, false));

        assertTrue(response.text().contains(TerminalResponseComposer.NO_FINDINGS));
    }
}
