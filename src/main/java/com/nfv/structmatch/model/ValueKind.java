package com.nfv.structmatch.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Kinds of canonical values
 * Every value produced by the normalizer is classified as exactly one of these
 */
public enum ValueKind {
    /**
     * Java null
     */
    NULL,

    /**
     * {@link Boolean}
     */
    BOOLEAN,

    /**
     * {@link Double}, every numeric input is widened to it
     */
    NUMBER,

    /**
     * {@link String}
     */
    STRING,

    /**
     * {@link OffsetDateTime}, only present when time values are preserved
     */
    TIME,

    /**
     * String-keyed {@link Map}
     */
    OBJECT,

    /**
     * {@link List}
     */
    ARRAY,

    /**
     * Anything else. Only reachable when normalization ran without the JSON fallback
     */
    OTHER;

    /**
     * Classify a (normalized) value
     */
    public static ValueKind of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Double) {
            return NUMBER;
        }
        if (value instanceof String) {
            return STRING;
        }
        if (value instanceof OffsetDateTime) {
            return TIME;
        }
        if (value instanceof Map) {
            return OBJECT;
        }
        if (value instanceof List) {
            return ARRAY;
        }
        return OTHER;
    }

    /**
     * Check whether a value is null or the zero value of this kind.
     * Containers have no zero value besides null.
     */
    public boolean isZeroValue(Object value) {
        if (value == null) {
            return true;
        }
        switch (this) {
            case BOOLEAN:
                return Boolean.FALSE.equals(value);
            case NUMBER:
                return value instanceof Double && (Double) value == 0.0;
            case STRING:
                return "".equals(value);
            case TIME:
                return value instanceof OffsetDateTime && TimeValues.isZero((OffsetDateTime) value);
            default:
                return false;
        }
    }

    public boolean isContainer() {
        return this == OBJECT || this == ARRAY;
    }
}
