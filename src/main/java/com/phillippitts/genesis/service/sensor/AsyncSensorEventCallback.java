package com.phillippitts.genesis.service.sensor;

import com.phillippitts.genesis.domain.SensorEvent;

import java.util.concurrent.CompletionStage;

/**
 * Callback that starts asynchronous work per event.
 *
 * <p>The poller observes the returned stage for failures and logs them, but never waits on it.
 */
@FunctionalInterface
public interface AsyncSensorEventCallback extends SensorEventCallback {

    CompletionStage<?> onSensorEventAsync(SensorEvent event);

    @Override
    default void onSensorEvent(SensorEvent event) {
        onSensorEventAsync(event);
    }
}
