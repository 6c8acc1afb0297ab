package app.focustrack.service.decision;

import app.focustrack.domain.decision.DecisionVerdict;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerdictParserTest {

    private final VerdictParser parser = new VerdictParser();

    @Test
    void testParsesJsonEmbeddedInProse() {
        DecisionVerdict verdict = parser.parse("""
            Sure, here is my answer:
            ```json
            {"should_notify": true, "message": "Back to the report?", "confidence": 0.82, "reasoning": "Long pause mid-task"}
            ```
            """);

        assertTrue(verdict.shouldNotify());
        assertEquals("Back to the report?", verdict.message());
        assertEquals(0.82, verdict.confidence(), 1e-9);
        assertEquals("Long pause mid-task", verdict.reasoning());
    }

    @Test
    void testMissingJsonFieldsUseDefaults() {
        DecisionVerdict verdict = parser.parse("{\"should_notify\": false}");

        assertFalse(verdict.shouldNotify());
        assertEquals("{\"should_notify\": false}", verdict.message(), "Whole reply when message is missing");
        assertEquals(0.5, verdict.confidence());
        assertEquals("No reasoning provided", verdict.reasoning());
    }

    @Test
    void testConfidenceIsClamped() {
        assertEquals(1.0, parser.parse("{\"should_notify\": true, \"message\": \"m\", \"confidence\": 7}").confidence());
        assertEquals(0.0, parser.parse("{\"should_notify\": true, \"message\": \"m\", \"confidence\": -2}").confidence());
    }

    @Test
    void testPlainTextWithKeyword() {
        DecisionVerdict verdict = parser.parse("Yes, a reminder would help here.");

        assertTrue(verdict.shouldNotify());
        assertEquals(0.7, verdict.confidence());
        assertEquals("Yes, a reminder would help here.", verdict.message());
        assertEquals(VerdictParser.TEXT_REASONING, verdict.reasoning());
    }

    @Test
    void testPlainTextWithoutKeyword() {
        DecisionVerdict verdict = parser.parse("This looks like a normal break.");

        assertFalse(verdict.shouldNotify());
        assertEquals(0.3, verdict.confidence());
    }

    @Test
    void testBrokenJsonFallsBackToKeywords() {
        DecisionVerdict verdict = parser.parse("{should_notify: maybe} notify them");

        assertTrue(verdict.shouldNotify());
        assertEquals(VerdictParser.TEXT_REASONING, verdict.reasoning());
    }

    @Test
    void testNullReply() {
        DecisionVerdict verdict = parser.parse(null);

        assertFalse(verdict.shouldNotify());
        assertEquals("", verdict.message());
    }
}
