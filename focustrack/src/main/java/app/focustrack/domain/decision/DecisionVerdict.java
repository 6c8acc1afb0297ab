package app.focustrack.domain.decision;

/**
 * Structured decision output: whether to notify, with what message and how sure.
 */
public record DecisionVerdict(
    VerdictType type,
    boolean shouldNotify,
    String message,
    double confidence,      // clamped to [0, 1]
    String reasoning
) {
    public DecisionVerdict {
        if (type == null) {
            type = VerdictType.GET_FOCUS_BACK;
        }
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        message = message == null ? "" : message;
        reasoning = reasoning == null ? "" : reasoning;
    }

    public static DecisionVerdict focus(boolean shouldNotify, String message, double confidence, String reasoning) {
        return new DecisionVerdict(VerdictType.GET_FOCUS_BACK, shouldNotify, message, confidence, reasoning);
    }

    public DecisionVerdict withReasoning(String newReasoning) {
        return new DecisionVerdict(type, shouldNotify, message, confidence, newReasoning);
    }
}
