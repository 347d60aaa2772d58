package com.nfv.structmatch.merge;

import com.nfv.structmatch.comparison.StructuralComparator;
import com.nfv.structmatch.normalize.NormalizationException;
import com.nfv.structmatch.normalize.NormalizeOptions;
import com.nfv.structmatch.normalize.Normalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deep merge and conflict detection for value trees
 */
@Slf4j
public class TreeMerger {

    private TreeMerger() {
    }

    /**
     * Deep merge v2 into a copy of v1.
     *
     * Objects are merged key by key, arrays by appending the v2 elements not already
     * present, and for anything else v2 wins. Neither argument is modified.
     *
     * @return normalized merge result, sharing no containers with the arguments
     */
    public static Object merge(Object v1, Object v2) {
        Object n1 = normalizeForMerge(v1, "v1");
        Object n2 = normalizeForMerge(v2, "v2");
        return mergeValues(n1, n2);
    }

    /**
     * Check if merging v2 into v1 would overwrite any value of v1
     */
    public static boolean conflicts(Object v1, Object v2) {
        Object merged = merge(v1, v2);
        boolean conflicting = !StructuralComparator.contains(merged, v1);
        if (conflicting) {
            log.debug("Merge result no longer contains v1");
        }
        return conflicting;
    }

    @SuppressWarnings("unchecked")
    static Object mergeValues(Object v1, Object v2) {
        if (v1 instanceof Map && v2 instanceof Map) {
            Map<String, Object> result = new LinkedHashMap<>((Map<String, Object>) v1);
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) v2).entrySet()) {
                String key = entry.getKey();
                if (result.containsKey(key)) {
                    result.put(key, mergeValues(result.get(key), entry.getValue()));
                } else {
                    result.put(key, entry.getValue());
                }
            }
            return result;
        }
        if (v1 instanceof List && v2 instanceof List) {
            List<Object> result = new ArrayList<>((List<Object>) v1);
            for (Object element : (List<Object>) v2) {
                if (!containsEqual(result, element)) {
                    result.add(element);
                }
            }
            return result;
        }
        return v2;
    }

    private static boolean containsEqual(List<Object> list, Object element) {
        for (Object existing : list) {
            if (Objects.equals(existing, element)) {
                return true;
            }
        }
        return false;
    }

    private static Object normalizeForMerge(Object value, String side) {
        Normalizer normalizer = Normalizer.getDefault();
        try {
            return normalizer.normalize(value);
        } catch (NormalizationException e) {
            log.warn("Cannot fully normalize {} for merge, merging as-is: {}", side, e.getMessage());
        }
        try {
            return normalizer.normalize(value, NormalizeOptions.builder().marshal(false).build());
        } catch (NormalizationException e) {
            throw new IllegalStateException("Normalization without marshalling failed for " + side, e);
        }
    }
}
