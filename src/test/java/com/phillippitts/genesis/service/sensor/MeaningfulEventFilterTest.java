package com.phillippitts.genesis.service.sensor;

import com.phillippitts.genesis.service.hardware.SensorEventKeys;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MeaningfulEventFilterTest {

    @Test
    void shouldAcceptRecognizedWordsWithText() {
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.WORD_RECOGNIZED, List.of("hello", 0.8)))
                .isTrue();
    }

    @Test
    void shouldRejectEmptyOrBlankRecognition() {
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.WORD_RECOGNIZED, List.of())).isFalse();
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.WORD_RECOGNIZED, List.of("  ", 0.4))).isFalse();
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.WORD_RECOGNIZED, "hello")).isFalse();
    }

    @Test
    void shouldAcceptTouchOnlyWhenPressed() {
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.FRONT_HEAD_TOUCHED, 1)).isTrue();
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.FRONT_HEAD_TOUCHED, 1.0f)).isTrue();
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.FRONT_HEAD_TOUCHED, 0)).isFalse();
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.TOUCH_CHANGED, List.of(0, 1))).isTrue();
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.TOUCH_CHANGED, List.of(0, 0))).isFalse();
    }

    @Test
    void shouldAcceptSpeechDoneOnlyForOne() {
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.TEXT_DONE, 1)).isTrue();
        assertThat(MeaningfulEventFilter.isMeaningful(SensorEventKeys.TEXT_DONE, 0)).isFalse();
    }

    @Test
    void shouldUseTruthinessForOtherKeys() {
        assertThat(MeaningfulEventFilter.isMeaningful("BatteryLow", true)).isTrue();
        assertThat(MeaningfulEventFilter.isMeaningful("BatteryLow", 0)).isFalse();
        assertThat(MeaningfulEventFilter.isMeaningful("Custom", "")).isFalse();
        assertThat(MeaningfulEventFilter.isMeaningful("Custom", Map.of())).isFalse();
        assertThat(MeaningfulEventFilter.isMeaningful("Custom", new int[] {3})).isTrue();
        assertThat(MeaningfulEventFilter.isMeaningful("Custom", null)).isFalse();
    }
}
