package app.focustrack.service.decision;

import app.focustrack.domain.decision.DecisionContext;
import app.focustrack.domain.decision.DecisionVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider that asks an external language model for the verdict.
 * Failures propagate; {@link DecisionService} converts them to the fallback.
 */
public final class ModelDecisionProvider implements DecisionProvider {
    private static final Logger log = LoggerFactory.getLogger(ModelDecisionProvider.class);

    private final TextGenerationClient client;
    private final FocusPromptBuilder promptBuilder;
    private final VerdictParser parser;

    public ModelDecisionProvider(TextGenerationClient client) {
        this(client, new FocusPromptBuilder(), new VerdictParser());
    }

    public ModelDecisionProvider(TextGenerationClient client, FocusPromptBuilder promptBuilder, VerdictParser parser) {
        this.client = client;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
    }

    @Override
    public String name() {
        return client.name();
    }

    @Override
    public DecisionVerdict generate(DecisionContext context) {
        String prompt = promptBuilder.build(context);
        log.debug("[DECISION] Asking {} (prompt length {})", client.name(), prompt.length());
        String reply = client.generate(prompt);
        DecisionVerdict verdict = parser.parse(reply);
        log.debug("[DECISION] {} replied: notify={}, confidence={}", client.name(),
            verdict.shouldNotify(), verdict.confidence());
        return verdict;
    }
}
