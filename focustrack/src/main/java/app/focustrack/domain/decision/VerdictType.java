package app.focustrack.domain.decision;

/**
 * Verdict tags produced by decision providers.
 */
public enum VerdictType {
    GET_FOCUS_BACK
}
