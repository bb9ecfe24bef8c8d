package com.phillippitts.genesis.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersonaTest {

    @Test
    void shouldResolvePlaceholdersInSystemPrompt() {
        // Arrange
        Persona persona = new Persona("Buddy", "playful", "You are {name}, {tone}, speaking {language}.", "fr-FR");

        // Act
        String prompt = persona.systemPrompt();

        // Assert
        assertThat(prompt).isEqualTo("You are Buddy, playful, speaking fr-FR.");
    }

    @Test
    void shouldDefaultToneAndLanguageWhenBlank() {
        Persona persona = new Persona("Genesis", "  ", null, "");

        assertThat(persona.tone()).isEqualTo(Persona.DEFAULT_TONE);
        assertThat(persona.languageCode()).isEqualTo("en-US");
        assertThat(persona.systemPrompt()).isEmpty();
    }

    @Test
    void shouldBuildDefaultPersonaWithNeutralTone() {
        Persona persona = Persona.defaultPersona("en-GB");

        assertThat(persona.name()).isEqualTo("DefaultGenesis");
        assertThat(persona.tone()).isEqualTo("neutral");
        assertThat(persona.systemPrompt())
                .isEqualTo("You are DefaultGenesis, a helpful and friendly robot assistant. Answer in en-GB.");
    }

    @Test
    void shouldUseLowerCasedNameAsKey() {
        assertThat(new Persona("Professor", "formal", "", "en-US").key()).isEqualTo("professor");
    }

    @Test
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> new Persona(" ", "calm", "", "en-US"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
