package com.phillippitts.genesis.service.sensor;

import com.phillippitts.genesis.domain.SensorEvent;

/**
 * Receives meaningful sensor events. Invoked on the dialogue executor, never on the poller thread.
 */
@FunctionalInterface
public interface SensorEventCallback {

    void onSensorEvent(SensorEvent event);
}
