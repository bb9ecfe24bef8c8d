package com.phillippitts.genesis.service.dialogue;

import com.phillippitts.genesis.config.properties.PersonaProperties;
import com.phillippitts.genesis.domain.Persona;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only set of personas keyed by lower-cased name, in configuration order.
 *
 * <p>When no persona is configured the set holds the built-in {@link Persona#DEFAULT_NAME}.
 */
public final class PersonaRegistry {

    private static final Logger LOG = LogManager.getLogger(PersonaRegistry.class);

    private final Map<String, Persona> personas;

    public PersonaRegistry(List<Persona> personas, String defaultLanguage) {
        Map<String, Persona> byKey = new LinkedHashMap<>();
        for (Persona persona : personas) {
            if (byKey.put(persona.key(), persona) != null) {
                LOG.warn("Persona '{}' defined twice; keeping the last definition", persona.name());
            }
        }
        if (byKey.isEmpty()) {
            LOG.warn("No personas configured; using {}", Persona.DEFAULT_NAME);
            Persona fallback = Persona.defaultPersona(defaultLanguage);
            byKey.put(fallback.key(), fallback);
        }
        this.personas = Collections.unmodifiableMap(byKey);
    }

    public static PersonaRegistry fromProperties(PersonaProperties props, String defaultLanguage) {
        List<Persona> loaded = new ArrayList<>();
        for (PersonaProperties.Profile profile : props.getProfiles()) {
            String language = profile.getLanguageCode() == null ? defaultLanguage : profile.getLanguageCode();
            loaded.add(new Persona(profile.getName(), profile.getTone(), profile.getSystemPrompt(), language));
        }
        return new PersonaRegistry(loaded, defaultLanguage);
    }

    public Optional<Persona> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(personas.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * The preferred persona, or the first one when it is not defined.
     */
    public Persona initial(String preferredName) {
        Optional<Persona> preferred = find(preferredName);
        if (preferred.isEmpty()) {
            Persona first = personas.values().iterator().next();
            LOG.info("Persona '{}' not found; starting as {}", preferredName, first.name());
            return first;
        }
        return preferred.get();
    }

    public List<String> availableNames() {
        return personas.values().stream().map(Persona::name).toList();
    }

    public int size() {
        return personas.size();
    }
}
