package com.phillippitts.genesis.service.sensor;

import com.phillippitts.genesis.service.hardware.SensorEventKeys;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a raw memory sample is worth handing to the dialogue pipeline.
 *
 * <ul>
 *   <li>word recognition: a non-empty list whose first element is non-blank text</li>
 *   <li>touch keys: the value is 1, or a list containing 1</li>
 *   <li>speech done: the value is 1</li>
 *   <li>anything else: the value is truthy</li>
 * </ul>
 */
public final class MeaningfulEventFilter {

    private MeaningfulEventFilter() {
    }

    public static boolean isMeaningful(String key, Object value) {
        if (value == null) {
            return false;
        }
        if (SensorEventKeys.WORD_RECOGNIZED.equals(key)) {
            return isRecognizedWords(value);
        }
        if (key.contains("Touched") || key.contains("TouchChanged")) {
            return isOne(value) || listContainsOne(value);
        }
        if (key.contains("TextDone")) {
            return isOne(value);
        }
        return isTruthy(value);
    }

    private static boolean isRecognizedWords(Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return false;
        }
        Object first = list.get(0);
        return first instanceof CharSequence text && !text.toString().isBlank();
    }

    static boolean isOne(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value instanceof Number number && number.doubleValue() == 1.0;
    }

    private static boolean listContainsOne(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream().anyMatch(MeaningfulEventFilter::isOne);
        }
        return false;
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> values) {
            return !values.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }
}
