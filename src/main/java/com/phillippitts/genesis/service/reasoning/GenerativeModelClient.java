package com.phillippitts.genesis.service.reasoning;

/**
 * Blocking transport to a generative model.
 */
@FunctionalInterface
public interface GenerativeModelClient {

    /**
     * Sends one prompt and returns the generated text.
     *
     * @return generated text, or {@code null} when the model returned nothing usable
     *         (no candidates, or the reply was blocked)
     * @throws RuntimeException on transport or protocol errors
     */
    String generate(String prompt);
}
