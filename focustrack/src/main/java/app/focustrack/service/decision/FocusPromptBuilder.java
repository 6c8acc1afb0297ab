package app.focustrack.service.decision;

import app.focustrack.domain.activity.WindowPayload;
import app.focustrack.domain.decision.DecisionContext;

import java.util.stream.Collectors;

/**
 * Builds the focus-analysis prompt sent to a text-generation model.
 */
public final class FocusPromptBuilder {

    private static final String TEMPLATE = """
        You are a productivity assistant that helps people keep their focus.

        SITUATION:
        - The user has been idle for %d seconds (%d minutes).
        - Windows they used right before going idle:
        %s

        SESSION:
        - Session length: %d minutes
        - Window switches: %d
        - Most used application: %s

        TASK:
        Decide whether this idle period looks like lost focus rather than a normal
        break, and whether a gentle reminder would help.

        Reply with JSON only:
        {
          "should_notify": boolean,
          "message": "short, encouraging reminder tailored to their work (max 100 chars)",
          "confidence": number between 0 and 1,
          "reasoning": "one sentence explaining the decision"
        }

        Guidelines:
        - Breaks under 5 minutes are normal, do not notify for them
        - Refer to what they were working on when you can
        - Be encouraging, never judgmental
        - Frequent switching between many apps can indicate distraction
        """;

    public String build(DecisionContext context) {
        String windows = context.recentWindows().isEmpty()
            ? "- (no recent window activity)"
            : context.recentWindows().stream()
                .map(WindowPayload::describe)
                .map(w -> "- " + w)
                .collect(Collectors.joining("\n"));

        long idle = context.idleDurationSeconds();
        return String.format(TEMPLATE,
            idle,
            Math.round(idle / 60.0),
            windows,
            Math.round(context.sessionDurationMillis() / 60_000.0),
            context.windowChangeCount(),
            context.mostUsedApp());
    }
}
