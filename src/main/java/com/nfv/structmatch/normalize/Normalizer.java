package com.nfv.structmatch.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializable;
import com.nfv.structmatch.model.RawJson;
import com.nfv.structmatch.model.TimeValues;
import com.nfv.structmatch.model.TreePath;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Array;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts arbitrary values into canonical trees of maps, lists and scalars.
 *
 * <p>Primitives pass through, numbers are widened to double, string-keyed maps and
 * sequences are copied into LinkedHashMap/ArrayList, and everything else is sent
 * through a JSON round trip with Jackson. The result is what Jackson would produce
 * when decoding the value's JSON into {@code Object.class}, so normalizing twice
 * yields the same tree.
 */
@Slf4j
public class Normalizer {

    private static final Normalizer DEFAULT = new Normalizer(JsonCodec.getDefault());

    private final JsonCodec codec;

    public Normalizer(JsonCodec codec) {
        this.codec = codec;
    }

    public static Normalizer getDefault() {
        return DEFAULT;
    }

    /**
     * Normalize with the default options: deep copy, JSON fallback, times as strings
     */
    public Object normalize(Object value) throws NormalizationException {
        return normalize(value, NormalizeOptions.defaults());
    }

    public Object normalize(Object value, NormalizeOptions options) throws NormalizationException {
        return normalizeValue(value, options, new TreePath());
    }

    private Object normalizeValue(Object value, NormalizeOptions options, TreePath path)
            throws NormalizationException {
        if (value == null || value instanceof Boolean || value instanceof Double) {
            return value;
        }
        if (value instanceof String) {
            if (options.isPreserveTime()) {
                OffsetDateTime time = TimeValues.parse((String) value);
                if (time != null) {
                    return time;
                }
            }
            return value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (TimeValues.isTimeValue(value)) {
            return normalizeTime(value, options);
        }

        boolean container = value instanceof Map || value instanceof Collection || isSequenceArray(value);
        if (container && !options.isCopy() && !options.isDeep()) {
            return value;
        }

        if (options.isMarshal() && (value instanceof RawJson || value instanceof JsonSerializable)) {
            return marshal(value, options, path);
        }

        if (value instanceof Map && hasOnlyStringKeys((Map<?, ?>) value)) {
            return normalizeMap((Map<?, ?>) value, options, path);
        }
        if (value instanceof List) {
            return normalizeList((List<?>) value, options, path);
        }
        if (value instanceof Collection) {
            return normalizeSequence(new ArrayList<Object>((Collection<?>) value), options, path);
        }
        if (isSequenceArray(value)) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return normalizeSequence(elements, options, path);
        }

        if (options.isMarshal()) {
            return marshal(value, options, path);
        }
        return value;
    }

    private Object normalizeTime(Object value, NormalizeOptions options) {
        if (options.isPreserveTime()) {
            return TimeValues.toOffsetDateTime(value);
        }
        if (options.isMarshal()) {
            return TimeValues.format(TimeValues.toOffsetDateTime(value));
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private Object normalizeMap(Map<?, ?> map, NormalizeOptions options, TreePath path)
            throws NormalizationException {
        if (!options.isDeep()) {
            // only reached in copy mode
            return new LinkedHashMap<String, Object>((Map<String, Object>) map);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        boolean changed = options.isCopy();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = (String) entry.getKey();
            path.push(key);
            Object normalized = normalizeValue(entry.getValue(), options, path);
            path.pop();
            if (normalized != entry.getValue()) {
                changed = true;
            }
            result.put(key, normalized);
        }
        return changed ? result : map;
    }

    private Object normalizeList(List<?> list, NormalizeOptions options, TreePath path)
            throws NormalizationException {
        if (!options.isDeep()) {
            return new ArrayList<Object>(list);
        }

        List<Object> result = new ArrayList<>(list.size());
        boolean changed = options.isCopy();
        for (int i = 0; i < list.size(); i++) {
            Object element = list.get(i);
            path.push(i);
            Object normalized = normalizeValue(element, options, path);
            path.pop();
            if (normalized != element) {
                changed = true;
            }
            result.add(normalized);
        }
        return changed ? result : list;
    }

    /**
     * Elements already copied out of a non-list collection or an array, so the result is always fresh
     */
    private List<Object> normalizeSequence(List<Object> elements, NormalizeOptions options, TreePath path)
            throws NormalizationException {
        if (!options.isDeep()) {
            return elements;
        }
        for (int i = 0; i < elements.size(); i++) {
            path.push(i);
            elements.set(i, normalizeValue(elements.get(i), options, path));
            path.pop();
        }
        return elements;
    }

    private Object marshal(Object value, NormalizeOptions options, TreePath path) throws NormalizationException {
        Object decoded;
        try {
            if (value instanceof RawJson) {
                decoded = codec.decode((RawJson) value);
            } else {
                decoded = codec.roundTrip(value);
            }
        } catch (JsonProcessingException e) {
            String location = path.isRoot() ? "root" : path.toString();
            log.debug("JSON round trip failed for {} at {}", value.getClass().getName(), location);
            throw new NormalizationException(
                    String.format("cannot marshal %s at %s: %s", value.getClass().getName(), location,
                            e.getOriginalMessage()),
                    path.snapshot(), value, e);
        }

        // the decoded tree is owned, only numbers and times still need rewriting
        NormalizeOptions decodedOptions = options.toBuilder()
                .copy(false)
                .deep(true)
                .marshal(false)
                .build();
        return normalizeValue(decoded, decodedOptions, path);
    }

    private static boolean hasOnlyStringKeys(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Arrays other than byte[], which Jackson writes as a base64 string
     */
    private static boolean isSequenceArray(Object value) {
        return value.getClass().isArray() && !(value instanceof byte[]);
    }
}
