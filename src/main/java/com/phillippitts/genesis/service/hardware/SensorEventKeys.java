package com.phillippitts.genesis.service.hardware;

import java.util.List;

/**
 * Names of the event keys the poller monitors by default.
 */
public final class SensorEventKeys {

    public static final String WORD_RECOGNIZED = "WordRecognized";
    public static final String TEXT_DONE = "ALTextToSpeech/TextDone";
    public static final String TOUCH_CHANGED = "TouchChanged";
    public static final String FRONT_HEAD_TOUCHED = "FrontTactilTouched";
    public static final String MIDDLE_HEAD_TOUCHED = "MiddleTactilTouched";
    public static final String REAR_HEAD_TOUCHED = "RearTactilTouched";

    public static final List<String> DEFAULT_MONITORED = List.of(
            WORD_RECOGNIZED,
            TEXT_DONE,
            TOUCH_CHANGED,
            FRONT_HEAD_TOUCHED,
            MIDDLE_HEAD_TOUCHED,
            REAR_HEAD_TOUCHED
    );

    private static final List<String> HEAD_TOUCH_KEYS = List.of(
            FRONT_HEAD_TOUCHED, MIDDLE_HEAD_TOUCHED, REAR_HEAD_TOUCHED);

    private SensorEventKeys() {
    }

    public static boolean isHeadTouch(String key) {
        return HEAD_TOUCH_KEYS.contains(key);
    }
}
