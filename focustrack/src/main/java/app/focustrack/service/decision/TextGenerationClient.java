package app.focustrack.service.decision;

/**
 * External text-generation capability (a hosted language model).
 */
public interface TextGenerationClient {

    String name();

    /**
     * Generate a completion for {@code prompt}.
     *
     * @throws TextGenerationException on transport, authentication or response errors
     */
    String generate(String prompt);
}
