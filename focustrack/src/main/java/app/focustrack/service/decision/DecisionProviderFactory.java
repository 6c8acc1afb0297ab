package app.focustrack.service.decision;

import app.focustrack.config.MonitorConfig;
import app.focustrack.config.ProviderType;
import app.focustrack.infrastructure.llm.GeminiTextGenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates decision providers from configuration.
 */
public final class DecisionProviderFactory {
    private static final Logger log = LoggerFactory.getLogger(DecisionProviderFactory.class);

    private final FallbackDecisionProvider fallback;

    public DecisionProviderFactory(FallbackDecisionProvider fallback) {
        this.fallback = fallback;
    }

    /**
     * @throws IllegalArgumentException if the provider needs credentials that are missing
     */
    public DecisionProvider create(ProviderType type, String apiKey, String model, MonitorConfig config) {
        switch (type) {
            case GEMINI:
                if (apiKey == null || apiKey.isBlank()) {
                    throw new IllegalArgumentException("Gemini API key is required");
                }
                return new ModelDecisionProvider(
                    new GeminiTextGenerationClient(apiKey, model, config.providerTimeout()));
            case FALLBACK:
                return fallback;
            default:
                throw new IllegalArgumentException("Unknown provider type: " + type);
        }
    }

    /**
     * Create the configured provider, or the fallback if that is not possible.
     */
    public DecisionProvider createWithFallback(MonitorConfig config) {
        try {
            return create(config.providerType(), config.providerApiKey(), config.providerModel(), config);
        } catch (IllegalArgumentException e) {
            log.warn("[DECISION] Failed to create {} provider, falling back: {}", config.providerType(), e.getMessage());
            return fallback;
        }
    }
}
