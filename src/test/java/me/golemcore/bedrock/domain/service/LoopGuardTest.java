package me.golemcore.bedrock.domain.service;

import me.golemcore.bedrock.domain.model.ConversationTurn;
import me.golemcore.bedrock.domain.model.LoopAssessment;
import me.golemcore.bedrock.infrastructure.config.BedrockProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoopGuardTest {

    private BedrockProperties properties;
    private LoopGuard loopGuard;

    @BeforeEach
    void setUp() {
        properties = new BedrockProperties();
        loopGuard = new LoopGuard(properties);
    }

    @Test
    void shouldNeverTerminateShortHistories() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("Call web_search for the deadline"),
                ConversationTurn.assistant("Searching with web_search now"));

        LoopAssessment assessment = loopGuard.assess(history);

        assertEquals(2, assessment.searchCount());
        assertFalse(assessment.loopDetected());
        assertFalse(loopGuard.shouldForceTerminate(history));
        assertFalse(loopGuard.shouldForceTerminate(List.of()));
        assertFalse(loopGuard.shouldForceTerminate(null));
    }

    @Test
    void shouldNotTerminateOnSingleSearch() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("Tell me about the call for proposals"),
                ConversationTurn.assistant("{\"name\": \"web_search\", \"arguments\": {\"query\": \"call\"}}"),
                ConversationTurn.user("Here are the results"),
                ConversationTurn.assistant("The call closes in May."),
                ConversationTurn.user("Summarize it"));

        assertFalse(loopGuard.shouldForceTerminate(history));
        assertEquals(1, loopGuard.assess(history).searchCount());
    }

    @Test
    void shouldTerminateOnTwoSearches() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("Tell me about the call for proposals"),
                ConversationTurn.assistant("{\"name\": \"web_search\", \"arguments\": {\"query\": \"call\"}}"),
                ConversationTurn.user("Here are the results"),
                ConversationTurn.assistant("Searching again for more detail"),
                ConversationTurn.user("Summarize it"));

        LoopAssessment assessment = loopGuard.assess(history);

        assertEquals(2, assessment.searchCount());
        assertTrue(assessment.loopDetected());
        assertTrue(loopGuard.shouldForceTerminate(history));
    }

    @Test
    void shouldNotTerminateOnTwoPlanningTurns() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("Write the report"),
                ConversationTurn.assistant("Planning the sections first"),
                ConversationTurn.user("ok"),
                ConversationTurn.assistant("We need to decide on a structure"),
                ConversationTurn.user("go on"));

        assertEquals(2, loopGuard.assess(history).planningCount());
        assertFalse(loopGuard.shouldForceTerminate(history));
    }

    @Test
    void shouldTerminateOnThreePlanningTurns() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("Write the report"),
                ConversationTurn.assistant("Planning the sections first"),
                ConversationTurn.user("Let's plan it together"),
                ConversationTurn.assistant("Let's break this into parts"),
                ConversationTurn.user("go on"));

        assertEquals(3, loopGuard.assess(history).planningCount());
        assertTrue(loopGuard.shouldForceTerminate(history));
    }

    @Test
    void shouldOnlyInspectTheRecentWindow() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.assistant("web_search first"),
                ConversationTurn.assistant("web_search second"),
                ConversationTurn.user("one"),
                ConversationTurn.assistant("two"),
                ConversationTurn.user("three"),
                ConversationTurn.assistant("four"),
                ConversationTurn.user("five"));

        assertEquals(0, loopGuard.assess(history).searchCount());
        assertFalse(loopGuard.shouldForceTerminate(history));
        assertTrue(loopGuard.shouldForceTerminate(history, 7));
    }

    @ParameterizedTest
    @ValueSource(strings = { "Now build the HTML page", "Create a landing page", "Add some CSS styles" })
    void shouldExemptContentGeneration(String latest) {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("Research the topic"),
                ConversationTurn.assistant("web_search done"),
                ConversationTurn.assistant("searching more"),
                ConversationTurn.user(latest));

        LoopAssessment assessment = loopGuard.assess(history);

        assertTrue(assessment.loopDetected());
        assertTrue(assessment.contentGeneration());
        assertFalse(assessment.shouldForceTerminate());
    }

    @Test
    void shouldCountEachTurnOnceForSearchMarkers() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("hello"),
                ConversationTurn.assistant("searching with web_search, searching again with web_search"),
                ConversationTurn.user("and?"));

        assertEquals(1, loopGuard.assess(history).searchCount());
        assertFalse(loopGuard.shouldForceTerminate(history));
    }

    @Test
    void shouldDoNothingWhenDisabled() {
        properties.getLoopGuard().setEnabled(false);
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("web_search"),
                ConversationTurn.assistant("web_search"),
                ConversationTurn.user("web_search"));

        assertEquals(LoopAssessment.none(), loopGuard.assess(history));
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -2 })
    void shouldRejectNonPositiveWindow(int window) {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("web_search"),
                ConversationTurn.assistant("web_search"),
                ConversationTurn.user("web_search"));

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> loopGuard.shouldForceTerminate(history, window));
        assertTrue(exception.getMessage().contains(String.valueOf(window)));
    }
}
