package app.focustrack.service.decision;

import app.focustrack.domain.activity.WindowPayload;
import app.focustrack.domain.decision.DecisionContext;
import app.focustrack.domain.decision.DecisionVerdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelDecisionProviderTest {

    @Mock
    private TextGenerationClient client;

    @Test
    void testPromptCarriesContextAndReplyIsParsed() {
        when(client.generate(anyString())).thenReturn(
            "{\"should_notify\": true, \"message\": \"Finish the slides?\", \"confidence\": 0.9, \"reasoning\": \"r\"}");
        ModelDecisionProvider provider = new ModelDecisionProvider(client);

        DecisionContext context = new DecisionContext(1200,
            List.of(new WindowPayload("PowerPoint", "Quarterly review.pptx", "powerpnt")),
            45 * 60_000L, 12, "PowerPoint");
        DecisionVerdict verdict = provider.generate(context);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(client).generate(prompt.capture());
        assertTrue(prompt.getValue().contains("idle for 1200 seconds (20 minutes)"), prompt.getValue());
        assertTrue(prompt.getValue().contains("- PowerPoint: Quarterly review.pptx"), prompt.getValue());
        assertTrue(prompt.getValue().contains("Session length: 45 minutes"), prompt.getValue());
        assertTrue(prompt.getValue().contains("Window switches: 12"), prompt.getValue());

        assertTrue(verdict.shouldNotify());
        assertEquals("Finish the slides?", verdict.message());
        assertEquals(0.9, verdict.confidence(), 1e-9);
    }

    @Test
    void testNameComesFromClient() {
        when(client.name()).thenReturn("Gemini");

        assertEquals("Gemini", new ModelDecisionProvider(client).name());
    }

    @Test
    void testClientFailurePropagates() {
        when(client.name()).thenReturn("Gemini");
        when(client.generate(anyString())).thenThrow(new TextGenerationException("Gemini", 503, "unavailable"));
        ModelDecisionProvider provider = new ModelDecisionProvider(client);

        TextGenerationException e = assertThrows(TextGenerationException.class,
            () -> provider.generate(DecisionContext.idleOnly(600)));
        assertEquals(503, e.getStatusCode());
        assertEquals("Gemini", e.getProvider());
    }
}
