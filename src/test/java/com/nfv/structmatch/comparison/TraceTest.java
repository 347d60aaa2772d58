package com.nfv.structmatch.comparison;

import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

import static com.nfv.structmatch.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Diagnostic messages sent to the trace sink
 */
class TraceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(1987, 2, 10, 6, 30, 15, 0, ZoneOffset.ofHours(-5));

    private static String trace(Object v1, Object v2, ContainsOptions.ContainsOptionsBuilder builder) {
        AtomicReference<String> trace = new AtomicReference<>();
        StructuralComparator.contains(v1, v2, builder.trace(trace::set).build());
        return trace.get();
    }

    private static String trace(Object v1, Object v2) {
        return trace(v1, v2, ContainsOptions.builder());
    }

    @Test
    @DisplayName("Trace is empty when the values match and set when they do not")
    void testTraceSet() {
        Map<String, Object> v1 = map("color", "red");
        Map<String, Object> v2 = map("color", "red");

        assertEquals("", trace(v1, v2));
        v2.put("color", "blue");
        assertFalse(trace(v1, v2).isEmpty());
        assertDoesNotThrow(() -> StructuralComparator.contains(v1, v2, ContainsOptions.builder().trace(null).build()));
    }

    @Test
    @DisplayName("Scalar mismatches show both values as JSON")
    void testScalarTraces() {
        assertEquals("values are not equal\nv1 -> 1\nv2 -> 2", trace(1, 2));
        assertEquals("values are not equal\nv1 -> \"red\"\nv2 -> \"blue\"", trace("red", "blue"));
        assertEquals("values are not equal\nv1 -> \"red\"\nv2 -> 1", trace("red", 1));
        assertEquals("values are not equal\nv1 -> true\nv2 -> false", trace(true, false));
        assertEquals("values are not equal\nv1 -> true\nv2 -> null", trace(true, null));
        assertEquals("values are not equal\nv1 -> null\nv2 -> false", trace(null, false));
        assertEquals("values are not equal\nv1 -> 1\nv2 -> false", trace(1.0, false));
        assertEquals("values are not equal\nv1 -> 1.5\nv2 -> -3", trace(1.5, -3L));
        assertEquals("v1 does not contain v2\nv1 -> \"red\"\nv2 -> \"blue\"",
                trace("red", "blue", ContainsOptions.builder().stringContains(true)));
    }

    @Test
    @DisplayName("Object mismatches report the path to the differing value")
    void testObjectTraces() {
        assertEquals("values are not equal\nv1 -> {\"color\":\"red\"}\nv2 -> 1",
                trace(map("color", "red"), 1));
        assertEquals("values are not equal\nv1.color -> \"red\"\nv2.color -> \"blue\"",
                trace(map("color", "red"), map("color", "blue")));
        assertEquals("values are not equal\nv1.color.height -> \"tall\"\nv2.color.height -> \"short\"",
                trace(map("color", map("height", "tall")), map("color", map("height", "short"))));
        assertEquals("v2 contains extra keys: [flavor, size]\n"
                        + "v1 -> {\"color\":\"blue\"}\n"
                        + "v2 -> {\"color\":\"blue\",\"flavor\":\"strawberry\",\"size\":\"big\"}",
                trace(map("color", "blue"), map("color", "blue", "size", "big", "flavor", "strawberry")));
    }

    @Test
    @DisplayName("Array mismatches report the missing element")
    void testArrayTraces() {
        assertEquals("v1 does not contain v2[1]: 2\nv1 -> [1]\nv2 -> [1,2]",
                trace(new int[]{1}, new int[]{1, 2}));
        assertEquals("v1 does not contain v2\nv1 -> [\"red\",\"green\"]\nv2 -> \"blue\"",
                trace(list("red", "green"), "blue"));
        assertEquals("v1 does not contain v2[0]: \"c\"\nv1.tags -> [\"a\",\"b\"]\nv2.tags -> [\"c\"]",
                trace(map("tags", list("a", "b")), map("tags", list("c"))),
                "Failed candidates must not leak into the trace");
    }

    @Test
    @DisplayName("Time mismatches explain the delta or the offset")
    void testTimeTraces() {
        assertEquals("values are not equal\n"
                        + "v1.time -> \"1987-02-10T06:30:15-05:00\"\n"
                        + "v2.time -> \"1987-02-10T06:31:15-05:00\"",
                trace(map("time", NOW), map("time", NOW.plusMinutes(1)), ContainsOptions.builder().parseTimes(true)));
        assertEquals("delta of PT1M exceeds PT30S\n"
                        + "v1.time -> \"1987-02-10T06:30:15-05:00\"\n"
                        + "v2.time -> \"1987-02-10T06:31:15-05:00\"",
                trace(map("time", NOW), map("time", NOW.plusMinutes(1)),
                        ContainsOptions.builder().allowTimeDelta(Duration.ofSeconds(30))));
        assertEquals("time zone offsets don't match\n"
                        + "v1.time -> \"1987-02-10T06:30:15-05:00\"\n"
                        + "v2.time -> \"1987-02-10T05:30:15-06:00\"",
                trace(map("time", NOW), map("time", NOW.withOffsetSameInstant(ZoneOffset.ofHours(-6))),
                        ContainsOptions.builder().parseTimes(true)));
    }

    @Test
    @DisplayName("Equivalence traces report extra keys and length differences")
    void testEquivalenceTraces() {
        AtomicReference<String> trace = new AtomicReference<>();
        ContainsOptions options = ContainsOptions.builder().trace(trace::set).build();

        assertFalse(StructuralComparator.equivalent(list("red", "green"), list("red"), options));
        assertEquals("arrays have different lengths: 2 != 1\nv1 -> [\"red\",\"green\"]\nv2 -> [\"red\"]", trace.get());

        assertFalse(StructuralComparator.equivalent(list("blue", "red"), list("red", "red"), options));
        assertEquals("v2 does not contain v1[0]: \"blue\"\nv1 -> [\"blue\",\"red\"]\nv2 -> [\"red\",\"red\"]",
                trace.get());

        assertTrue(StructuralComparator.equivalent(list("red"), list("red"), options));
        assertEquals("", trace.get());
    }
}
