package app.focustrack.service.pattern;

import java.util.Locale;

/**
 * Focus quality band derived from the average session focus score.
 */
public enum FocusQuality {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static FocusQuality fromScore(double averageFocusScore) {
        if (averageFocusScore >= 0.8) return EXCELLENT;
        if (averageFocusScore >= 0.6) return GOOD;
        if (averageFocusScore >= 0.4) return FAIR;
        return POOR;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
