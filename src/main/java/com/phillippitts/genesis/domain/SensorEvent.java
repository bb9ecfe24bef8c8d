package com.phillippitts.genesis.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A meaningful sample read from the hardware link's event memory.
 *
 * <p>The value is whatever the link reported: a scalar, a small list, or a
 * {@code [text, confidence]} pair for recognized words. Consumers must treat it as read-only.
 *
 * @param eventName monitored key the sample was read from
 * @param value raw sample value (never null)
 * @param timestamp time the poller observed the sample
 */
public record SensorEvent(String eventName, Object value, Instant timestamp) {

    public SensorEvent {
        Objects.requireNonNull(eventName, "eventName must not be null");
        if (eventName.isBlank()) {
            throw new IllegalArgumentException("eventName must not be blank");
        }
        Objects.requireNonNull(value, "value must not be null");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static SensorEvent of(String eventName, Object value) {
        return new SensorEvent(eventName, value, Instant.now());
    }
}
