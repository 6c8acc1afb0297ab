package app.focustrack.service.decision;

import app.focustrack.domain.decision.DecisionContext;
import app.focustrack.domain.decision.DecisionVerdict;

/**
 * Deterministic provider: no external call, idle duration bucketed into three bands.
 */
public final class FallbackDecisionProvider implements DecisionProvider {

    public static final String NAME = "Fallback";

    static final long LONG_BREAK_SECONDS = 1800;
    static final long MEDIUM_BREAK_SECONDS = 900;
    static final long NOTIFY_FLOOR_SECONDS = 300;
    static final double CONFIDENCE = 0.5;

    static final String LONG_BREAK_MESSAGE = "Long break detected! Ready to refocus and tackle your goals? 🚀";
    static final String MEDIUM_BREAK_MESSAGE = "Welcome back! Time to dive into productive work 💪";
    static final String SHORT_BREAK_MESSAGE = "Quick break's over! Let's get back to work ⚡";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DecisionVerdict generate(DecisionContext context) {
        return verdict(context.idleDurationSeconds(), "Fallback heuristic based on idle duration");
    }

    /**
     * Verdict used when another provider failed.
     */
    public DecisionVerdict substituteFor(String failedProvider, DecisionContext context) {
        return verdict(context.idleDurationSeconds(), "Fallback due to " + failedProvider + " provider error");
    }

    private DecisionVerdict verdict(long idleSeconds, String reasoning) {
        String message;
        if (idleSeconds > LONG_BREAK_SECONDS) {
            message = LONG_BREAK_MESSAGE;
        } else if (idleSeconds > MEDIUM_BREAK_SECONDS) {
            message = MEDIUM_BREAK_MESSAGE;
        } else {
            message = SHORT_BREAK_MESSAGE;
        }
        return DecisionVerdict.focus(idleSeconds > NOTIFY_FLOOR_SECONDS, message, CONFIDENCE, reasoning);
    }
}
