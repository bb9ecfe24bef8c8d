package com.phillippitts.genesis.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Dialogue behaviour: initial persona, styling, transcript location and shutdown grace.
 */
@Validated
@ConfigurationProperties(prefix = "genesis.dialogue")
public class DialogueProperties {

    /** Persona selected at startup (case-insensitive). Falls back to the first configured persona. */
    private String defaultPersona = "genesis";

    /** Restyle internal replies through the reasoning backend using the active persona. */
    private boolean stylingEnabled = true;

    @NotBlank
    private String language = "en-US";

    @NotBlank
    private String interactionLogPath = "logs/interactions.log";

    /** How long shutdown waits for in-flight turns before cancelling them. */
    @PositiveOrZero
    private long shutdownGraceMs = 3000;

    private boolean greetingEnabled = true;

    /** Spoken when a head tactile sensor is touched. Blank disables the response. */
    private String touchResponse = "Please don't touch my head.";

    public String getDefaultPersona() {
        return defaultPersona;
    }

    public void setDefaultPersona(String defaultPersona) {
        this.defaultPersona = defaultPersona;
    }

    public boolean isStylingEnabled() {
        return stylingEnabled;
    }

    public void setStylingEnabled(boolean stylingEnabled) {
        this.stylingEnabled = stylingEnabled;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getInteractionLogPath() {
        return interactionLogPath;
    }

    public void setInteractionLogPath(String interactionLogPath) {
        this.interactionLogPath = interactionLogPath;
    }

    public long getShutdownGraceMs() {
        return shutdownGraceMs;
    }

    public void setShutdownGraceMs(long shutdownGraceMs) {
        this.shutdownGraceMs = shutdownGraceMs;
    }

    public boolean isGreetingEnabled() {
        return greetingEnabled;
    }

    public void setGreetingEnabled(boolean greetingEnabled) {
        this.greetingEnabled = greetingEnabled;
    }

    public String getTouchResponse() {
        return touchResponse;
    }

    public void setTouchResponse(String touchResponse) {
        this.touchResponse = touchResponse;
    }

    public Duration shutdownGrace() {
        return Duration.ofMillis(shutdownGraceMs);
    }
}
