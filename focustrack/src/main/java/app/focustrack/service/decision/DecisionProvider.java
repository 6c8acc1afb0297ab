package app.focustrack.service.decision;

import app.focustrack.domain.decision.DecisionContext;
import app.focustrack.domain.decision.DecisionVerdict;

/**
 * Produces a focus-notification verdict from idle duration and recent activity.
 *
 * Implementations may block and may throw; {@link DecisionService} bounds the
 * call and substitutes the deterministic fallback on any failure.
 */
public interface DecisionProvider {

    /**
     * Display name used in logs and fallback reasoning.
     */
    String name();

    DecisionVerdict generate(DecisionContext context);
}
