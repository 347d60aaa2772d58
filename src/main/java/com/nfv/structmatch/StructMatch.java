package com.nfv.structmatch;

import com.nfv.structmatch.comparison.ContainsOptions;
import com.nfv.structmatch.comparison.StructuralComparator;
import com.nfv.structmatch.merge.NodeTransformer;
import com.nfv.structmatch.merge.TransformException;
import com.nfv.structmatch.merge.TreeMerger;
import com.nfv.structmatch.merge.TreeTransformer;
import com.nfv.structmatch.model.Match;
import com.nfv.structmatch.normalize.EmptyValues;
import com.nfv.structmatch.normalize.NormalizationException;
import com.nfv.structmatch.normalize.NormalizeOptions;
import com.nfv.structmatch.normalize.Normalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Entry point for library use. POJOs, maps and parsed JSON are interchangeable arguments.
 */
public final class StructMatch {

    private StructMatch() {
    }

    public static Object normalize(Object value) throws NormalizationException {
        return Normalizer.getDefault().normalize(value);
    }

    public static Object normalize(Object value, NormalizeOptions options) throws NormalizationException {
        return Normalizer.getDefault().normalize(value, options);
    }

    public static boolean contains(Object v1, Object v2) {
        return StructuralComparator.contains(v1, v2);
    }

    public static boolean contains(Object v1, Object v2, ContainsOptions options) {
        return StructuralComparator.contains(v1, v2, options);
    }

    public static Match containsMatch(Object v1, Object v2, ContainsOptions options) {
        return StructuralComparator.containsMatch(v1, v2, options);
    }

    public static boolean equivalent(Object v1, Object v2) {
        return StructuralComparator.equivalent(v1, v2);
    }

    public static boolean equivalent(Object v1, Object v2, ContainsOptions options) {
        return StructuralComparator.equivalent(v1, v2, options);
    }

    public static Match equivalentMatch(Object v1, Object v2, ContainsOptions options) {
        return StructuralComparator.equivalentMatch(v1, v2, options);
    }

    public static Object merge(Object v1, Object v2) {
        return TreeMerger.merge(v1, v2);
    }

    public static boolean conflicts(Object v1, Object v2) {
        return TreeMerger.conflicts(v1, v2);
    }

    public static Object transform(Object value, NodeTransformer transformer)
            throws NormalizationException, TransformException {
        return TreeTransformer.transform(value, transformer);
    }

    public static boolean isEmpty(Object value) {
        return EmptyValues.isEmpty(value);
    }

    /**
     * Sorted keys of a map, or of a value that normalizes to one
     *
     * @return the keys, empty when the value is not an object
     */
    public static List<String> keys(Object value) throws NormalizationException {
        Object normalized = Normalizer.getDefault().normalize(value,
                NormalizeOptions.builder().deep(false).copy(false).build());
        if (!(normalized instanceof Map)) {
            return Collections.emptyList();
        }
        List<String> keys = new ArrayList<>();
        for (Object key : ((Map<?, ?>) normalized).keySet()) {
            keys.add(String.valueOf(key));
        }
        Collections.sort(keys);
        return keys;
    }
}
