package com.nfv.structmatch.comparison;

import com.nfv.structmatch.model.Match;
import com.nfv.structmatch.model.TimeValues;
import com.nfv.structmatch.model.ValueKind;
import com.nfv.structmatch.normalize.JsonCodec;
import com.nfv.structmatch.normalize.NormalizationException;
import com.nfv.structmatch.normalize.NormalizeOptions;
import com.nfv.structmatch.normalize.Normalizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Structural comparison of value trees.
 *
 * <p>{@code contains(v1, v2)} checks whether v1 contains v2: every key of a v2 object is
 * present in v1 with a matching value, and every element of a v2 array matches some element
 * of the v1 array. {@code equivalent(v1, v2)} additionally requires v1 to have no extra keys
 * and arrays to match in both directions. Both sides are normalized first, so POJOs, maps and
 * parsed JSON compare alike.
 */
@Slf4j
public class StructuralComparator {

    private static final String NOT_EQUAL = "values are not equal";

    private StructuralComparator() {
    }

    public static boolean contains(Object v1, Object v2) {
        return contains(v1, v2, ContainsOptions.defaults());
    }

    public static boolean contains(Object v1, Object v2, ContainsOptions options) {
        return compare(v1, v2, options, false, false).isMatches();
    }

    /**
     * Containment check that reports where and why it failed
     */
    public static Match containsMatch(Object v1, Object v2, ContainsOptions options) {
        return compare(v1, v2, options, false, true);
    }

    public static boolean equivalent(Object v1, Object v2) {
        return equivalent(v1, v2, ContainsOptions.defaults());
    }

    public static boolean equivalent(Object v1, Object v2, ContainsOptions options) {
        return compare(v1, v2, options, true, false).isMatches();
    }

    public static Match equivalentMatch(Object v1, Object v2, ContainsOptions options) {
        return compare(v1, v2, options, true, true);
    }

    private static Match compare(Object v1, Object v2, ContainsOptions options,
                                 boolean equivalence, boolean detailed) {
        if (options == null) {
            options = ContainsOptions.defaults();
        }
        Consumer<String> trace = options.getTrace();
        NormalizeOptions normalizeOptions = NormalizeOptions.builder()
                .preserveTime(options.isTimeParsingEnabled())
                .build();
        Normalizer normalizer = Normalizer.getDefault();

        Object n1;
        try {
            n1 = normalizer.normalize(v1, normalizeOptions);
        } catch (NormalizationException e) {
            Object other = normalizeQuietly(v2, normalizeOptions);
            return normalizationFailure("v1", e, e.getValue(), e.getPath().resolve(other), trace);
        }
        Object n2;
        try {
            n2 = normalizer.normalize(v2, normalizeOptions);
        } catch (NormalizationException e) {
            return normalizationFailure("v2", e, e.getPath().resolve(n1), e.getValue(), trace);
        }

        ComparisonContext ctx = new ComparisonContext(options, equivalence, detailed || trace != null);
        boolean matched = matches(n1, n2, ctx);
        if (matched) {
            if (trace != null) {
                trace.accept("");
            }
            return Match.matched();
        }

        String message = ctx.describeMismatch();
        if (ctx.isMismatchRecorded()) {
            log.debug("Mismatch at '{}': {}", ctx.getMismatchPath(), ctx.getReason());
        }
        if (trace != null) {
            trace.accept(message);
        }
        return Match.builder()
                .matches(false)
                .message(message)
                .path(ctx.getMismatchPath().toString())
                .v1(ctx.getMismatchV1())
                .v2(ctx.getMismatchV2())
                .build();
    }

    private static Object normalizeQuietly(Object value, NormalizeOptions options) {
        try {
            return Normalizer.getDefault().normalize(value, options);
        } catch (NormalizationException e) {
            log.debug("Both operands failed to normalize: {}", e.getMessage());
            return null;
        }
    }

    private static Match normalizationFailure(String side, NormalizationException e,
                                              Object v1, Object v2, Consumer<String> trace) {
        String message = "err normalizing " + side + ": " + e.getMessage();
        log.debug(message);
        if (trace != null) {
            trace.accept(message);
        }
        return Match.builder()
                .matches(false)
                .message(message)
                .path(e.getPath().toString())
                .v1(v1)
                .v2(v2)
                .error(e)
                .build();
    }

    /**
     * Check if a (normalized) contains b (normalized) at the context's current path
     */
    static boolean matches(Object a, Object b, ComparisonContext ctx) {
        if (ctx.isIgnored()) {
            return true;
        }
        ContainsOptions options = ctx.getOptions();
        ValueKind kind = ValueKind.of(a);

        if (options.isEmptyValuesMatchAny() && kind.isZeroValue(b)) {
            return true;
        }

        switch (kind) {
            case NULL:
                return b == null || ctx.fail(NOT_EQUAL, a, b);
            case BOOLEAN:
                return a.equals(b) || ctx.fail(NOT_EQUAL, a, b);
            case NUMBER:
                return (b instanceof Double && ((Double) a).doubleValue() == (Double) b)
                        || ctx.fail(NOT_EQUAL, a, b);
            case STRING:
                return matchStrings((String) a, b, ctx);
            case TIME:
                return matchTimes((OffsetDateTime) a, b, ctx);
            case OBJECT:
                return matchObjects(a, b, ctx);
            case ARRAY:
                return matchArrays(a, b, ctx);
            case OTHER:
                return Objects.equals(a, b) || ctx.fail(NOT_EQUAL, a, b);
            default:
                throw new IllegalStateException("Unhandled value kind: " + kind);
        }
    }

    private static boolean matchStrings(String a, Object b, ComparisonContext ctx) {
        if (!(b instanceof String)) {
            return ctx.fail(NOT_EQUAL, a, b);
        }
        if (ctx.getOptions().isStringContains()) {
            return a.contains((String) b) || ctx.fail("v1 does not contain v2", a, b);
        }
        return a.equals(b) || ctx.fail(NOT_EQUAL, a, b);
    }

    private static boolean matchTimes(OffsetDateTime a, Object b, ComparisonContext ctx) {
        if (!(b instanceof OffsetDateTime)) {
            return ctx.fail(NOT_EQUAL, a, b);
        }
        OffsetDateTime t2 = (OffsetDateTime) b;
        ContainsOptions options = ctx.getOptions();

        if (!a.isEqual(t2)) {
            OffsetDateTime x = a;
            OffsetDateTime y = t2;
            if (options.getTruncateTimes() != null) {
                x = TimeValues.truncate(x, options.getTruncateTimes());
                y = TimeValues.truncate(y, options.getTruncateTimes());
            } else if (options.getRoundTimes() != null) {
                x = TimeValues.round(x, options.getRoundTimes());
                y = TimeValues.round(y, options.getRoundTimes());
            }
            Duration tolerance = options.getAllowTimeDelta() == null ? Duration.ZERO : options.getAllowTimeDelta().abs();
            Duration delta = Duration.between(x, y).abs();
            if (delta.compareTo(tolerance) > 0) {
                if (tolerance.isZero()) {
                    return ctx.fail(NOT_EQUAL, a, b);
                }
                return ctx.fail(() -> "delta of " + delta + " exceeds " + tolerance, a, b);
            }
        }

        if (!options.isIgnoreTimeZones() && !a.getOffset().equals(t2.getOffset())) {
            return ctx.fail("time zone offsets don't match", a, b);
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private static boolean matchObjects(Object a, Object b, ComparisonContext ctx) {
        if (!(b instanceof Map)) {
            return ctx.fail(NOT_EQUAL, a, b);
        }
        Map<String, Object> m1 = (Map<String, Object>) a;
        Map<String, Object> m2 = (Map<String, Object>) b;

        List<String> missing = missingKeys(m2, m1, ctx);
        if (!missing.isEmpty()) {
            return ctx.fail(() -> "v2 contains extra keys: " + missing, a, b);
        }
        if (ctx.isEquivalence()) {
            List<String> extra = missingKeys(m1, m2, ctx);
            if (!extra.isEmpty()) {
                return ctx.fail(() -> "v1 contains extra keys: " + extra, a, b);
            }
        }

        for (Map.Entry<String, Object> entry : m2.entrySet()) {
            ctx.getPath().push(entry.getKey());
            boolean matched = matches(m1.get(entry.getKey()), entry.getValue(), ctx);
            ctx.getPath().pop();
            if (!matched) {
                return false;
            }
        }
        return true;
    }

    /**
     * Sorted keys of source that are absent from target and not ignored
     */
    private static List<String> missingKeys(Map<String, Object> source, Map<String, Object> target,
                                            ComparisonContext ctx) {
        List<String> missing = new ArrayList<>();
        for (String key : source.keySet()) {
            if (target.containsKey(key)) {
                continue;
            }
            ctx.getPath().push(key);
            boolean ignored = ctx.isIgnored();
            ctx.getPath().pop();
            if (!ignored) {
                missing.add(key);
            }
        }
        Collections.sort(missing);
        return missing;
    }

    @SuppressWarnings("unchecked")
    private static boolean matchArrays(Object a, Object b, ComparisonContext ctx) {
        List<Object> l1 = (List<Object>) a;

        if (!(b instanceof List)) {
            if (ctx.isEquivalence()) {
                return ctx.fail(NOT_EQUAL, a, b);
            }
            return containsElement(l1, b, ctx) || ctx.fail("v1 does not contain v2", a, b);
        }

        List<Object> l2 = (List<Object>) b;
        if (ctx.isEquivalence() && l1.size() != l2.size()) {
            return ctx.fail(() -> "arrays have different lengths: " + l1.size() + " != " + l2.size(), a, b);
        }

        // matched elements stay in the candidate pool
        for (int i = 0; i < l2.size(); i++) {
            Object element = l2.get(i);
            if (!containsElement(l1, element, ctx)) {
                int index = i;
                return ctx.fail(() -> "v1 does not contain v2[" + index + "]: "
                        + JsonCodec.getDefault().render(element), a, b);
            }
        }

        if (ctx.isEquivalence()) {
            for (int i = 0; i < l1.size(); i++) {
                Object element = l1.get(i);
                if (!isContainedBy(element, l2, ctx)) {
                    int index = i;
                    return ctx.fail(() -> "v2 does not contain v1[" + index + "]: "
                            + JsonCodec.getDefault().render(element), a, b);
                }
            }
        }
        return true;
    }

    /**
     * Whether some element of candidates matches pattern. Failures of rejected candidates are not recorded.
     */
    private static boolean containsElement(List<Object> candidates, Object pattern, ComparisonContext ctx) {
        ctx.beginTrial();
        try {
            for (int i = 0; i < candidates.size(); i++) {
                ctx.getPath().push(i);
                boolean matched = matches(candidates.get(i), pattern, ctx);
                ctx.getPath().pop();
                if (matched) {
                    return true;
                }
            }
            return false;
        } finally {
            ctx.endTrial();
        }
    }

    /**
     * Whether subject matches some element of patterns
     */
    private static boolean isContainedBy(Object subject, List<Object> patterns, ComparisonContext ctx) {
        ctx.beginTrial();
        try {
            for (int i = 0; i < patterns.size(); i++) {
                ctx.getPath().push(i);
                boolean matched = matches(subject, patterns.get(i), ctx);
                ctx.getPath().pop();
                if (matched) {
                    return true;
                }
            }
            return false;
        } finally {
            ctx.endTrial();
        }
    }
}
