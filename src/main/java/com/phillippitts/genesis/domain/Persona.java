package com.phillippitts.genesis.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable persona definition.
 *
 * <p>The system prompt template may reference {@code {name}}, {@code {tone}} and
 * {@code {language}}; placeholders are resolved on every call to {@link #systemPrompt()}.
 */
public record Persona(String name, String tone, String systemPromptTemplate, String languageCode) {

    public static final String DEFAULT_NAME = "DefaultGenesis";
    public static final String DEFAULT_TONE = "neutral";

    public Persona {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        tone = (tone == null || tone.isBlank()) ? DEFAULT_TONE : tone.trim();
        systemPromptTemplate = systemPromptTemplate == null ? "" : systemPromptTemplate;
        languageCode = (languageCode == null || languageCode.isBlank()) ? "en-US" : languageCode.trim();
    }

    /**
     * Fallback persona used when no profiles are configured.
     */
    public static Persona defaultPersona(String languageCode) {
        return new Persona(DEFAULT_NAME, DEFAULT_TONE,
                "You are {name}, a helpful and friendly robot assistant. Answer in {language}.",
                languageCode);
    }

    public String systemPrompt() {
        return systemPromptTemplate
                .replace("{name}", name)
                .replace("{tone}", tone)
                .replace("{language}", languageCode);
    }

    /** Lookup key used by the persona registry. */
    public String key() {
        return name.toLowerCase(Locale.ROOT);
    }
}
