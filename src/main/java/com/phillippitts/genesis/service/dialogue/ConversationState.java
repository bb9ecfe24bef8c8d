package com.phillippitts.genesis.service.dialogue;

import com.phillippitts.genesis.domain.Persona;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Active persona and tone, held as one immutable snapshot.
 *
 * <p>Readers always see a persona and tone that were set together. Writers swap the snapshot
 * atomically without locking; concurrent writers resolve as last writer wins.
 */
public final class ConversationState {

    /**
     * Persona and tone as seen at one instant.
     */
    public record Snapshot(Persona persona, String tone) {
        public Snapshot {
            Objects.requireNonNull(persona, "persona must not be null");
            Objects.requireNonNull(tone, "tone must not be null");
        }
    }

    private final AtomicReference<Snapshot> current;

    public ConversationState(Persona initial) {
        this.current = new AtomicReference<>(new Snapshot(initial, initial.tone()));
    }

    public Snapshot snapshot() {
        return current.get();
    }

    /**
     * Activates a persona together with its default tone.
     */
    public Snapshot switchPersona(Persona persona) {
        Snapshot next = new Snapshot(persona, persona.tone());
        current.set(next);
        return next;
    }

    /**
     * Replaces the tone, keeping whichever persona is active at the time of the swap.
     */
    public Snapshot changeTone(String tone) {
        return current.updateAndGet(s -> new Snapshot(s.persona(), tone));
    }
}
