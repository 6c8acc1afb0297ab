package app.focustrack.service.decision;

/**
 * Exception thrown when an external text-generation call fails.
 */
public class TextGenerationException extends RuntimeException {

    private final String provider;
    private final int statusCode;   // HTTP status, or -1 when no response was received

    public TextGenerationException(String provider, String message) {
        this(provider, -1, message, null);
    }

    public TextGenerationException(String provider, int statusCode, String message) {
        this(provider, statusCode, message, null);
    }

    public TextGenerationException(String provider, int statusCode, String message, Throwable cause) {
        super(String.format("[%s] Text generation failed%s: %s",
            provider, statusCode > 0 ? " (HTTP " + statusCode + ")" : "", message), cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String getProvider() {
        return provider;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
