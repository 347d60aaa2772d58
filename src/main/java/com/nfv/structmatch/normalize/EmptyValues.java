package com.nfv.structmatch.normalize;

import com.nfv.structmatch.model.TimeValues;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Emptiness checks over raw or normalized values
 */
@Slf4j
public final class EmptyValues {

    private EmptyValues() {
    }

    /**
     * Check if a value is empty: null, a blank string, false, zero, an empty map,
     * collection, array or Optional, the zero time, or an object whose properties are all empty.
     */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return value.toString().trim().isEmpty();
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        if (value instanceof Number) {
            return isZero((Number) value);
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        if (value instanceof Optional) {
            return !((Optional<?>) value).isPresent();
        }
        if (TimeValues.isTimeValue(value)) {
            return TimeValues.isZero(TimeValues.toOffsetDateTime(value));
        }
        return isEmptyObject(value);
    }

    private static boolean isZero(Number number) {
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).signum() == 0;
        }
        if (number instanceof BigInteger) {
            return ((BigInteger) number).signum() == 0;
        }
        return number.doubleValue() == 0.0;
    }

    private static boolean isEmptyObject(Object value) {
        Object normalized;
        try {
            normalized = Normalizer.getDefault().normalize(value);
        } catch (NormalizationException e) {
            log.debug("Treating {} as non-empty: {}", value.getClass().getName(), e.getMessage());
            return false;
        }
        if (normalized instanceof Map) {
            for (Object property : ((Map<?, ?>) normalized).values()) {
                if (!isEmpty(property)) {
                    return false;
                }
            }
            return true;
        }
        return isEmpty(normalized);
    }
}
