package com.phillippitts.genesis.domain;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of classifying one utterance.
 *
 * @param intent intent name, never blank ({@code unknown} when nothing matched)
 * @param entities extracted slot values keyed by entity name
 * @param originalText the utterance as received
 */
public record IntentResult(String intent, Map<String, Object> entities, String originalText) {

    public IntentResult {
        Objects.requireNonNull(intent, "intent must not be null");
        if (intent.isBlank()) {
            throw new IllegalArgumentException("intent must not be blank");
        }
        entities = entities == null ? Map.of() : Map.copyOf(entities);
        originalText = originalText == null ? "" : originalText;
    }

    public static IntentResult of(String intent, String originalText) {
        return new IntentResult(intent, Map.of(), originalText);
    }

    /**
     * Returns the trimmed text form of an entity, empty when absent or blank.
     */
    public Optional<String> textEntity(String name) {
        Object value = entities.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
