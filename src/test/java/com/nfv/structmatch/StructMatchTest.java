package com.nfv.structmatch;

import com.nfv.structmatch.comparison.ContainsOptions;
import com.nfv.structmatch.model.Match;
import com.nfv.structmatch.model.RawJson;
import org.junit.jupiter.api.*;

import java.util.*;

import static com.nfv.structmatch.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour through the library entry point
 */
class StructMatchTest {

    @Test
    @DisplayName("POJOs, maps and parsed JSON compare alike")
    void testInterchangeableOperands() throws Exception {
        Widget widget = new Widget(2, "red");
        Object parsed = StructMatch.normalize(RawJson.of("{\"size\":2,\"color\":\"red\"}"));

        assertTrue(StructMatch.equivalent(widget, map("size", 2L, "color", "red")));
        assertTrue(StructMatch.equivalent(widget, parsed));
        assertTrue(StructMatch.contains(map("size", 2, "color", "red", "extra", true), widget));
        assertFalse(StructMatch.contains(widget, map("size", 2, "color", "red", "extra", true)));
    }

    @Test
    @DisplayName("Lenient options tolerate empty values and time zones")
    void testLenient() {
        Object actual = map("id", "a1", "createdAt", "2024-03-01T10:00:00Z", "owner", "bob");
        Object expected = map("id", "", "createdAt", "2024-03-01T05:00:00-05:00");

        assertFalse(StructMatch.contains(actual, expected));
        Match match = StructMatch.containsMatch(actual, expected, ContainsOptions.lenient());
        assertTrue(match.isMatches(), match.getMessage());
    }

    @Test
    @DisplayName("Merge, conflicts and transform work on mixed inputs")
    void testMergeAndTransform() throws Exception {
        Object merged = StructMatch.merge(new Widget(1, "red"), map("tags", list("a")));
        assertEquals(map("size", 1.0, "color", "red", "tags", list("a")), merged);
        assertTrue(StructMatch.conflicts(new Widget(1, "red"), map("color", "blue")));
        assertFalse(StructMatch.conflicts(new Widget(1, "red"), map("tags", list("a"))));

        Object doubled = StructMatch.transform(merged, node -> node instanceof Double ? (Double) node * 2 : node);
        assertEquals(map("size", 2.0, "color", "red", "tags", list("a")), doubled);
    }

    @Test
    @DisplayName("Keys are returned sorted for maps and POJOs")
    void testKeys() throws Exception {
        assertEquals(Arrays.asList("color", "price", "weight"),
                StructMatch.keys(map("weight", 2, "color", "blue", "price", "high")));
        assertEquals(Arrays.asList("color", "size"), StructMatch.keys(new Widget(1, "red")));
        assertEquals(Collections.emptyList(), StructMatch.keys(list("a")));
        assertEquals(Collections.emptyList(), StructMatch.keys(null));
    }

    @Test
    @DisplayName("Empty checks are exposed")
    void testIsEmpty() {
        assertTrue(StructMatch.isEmpty(new Widget()));
        assertFalse(StructMatch.isEmpty(new Widget(1, null)));
    }
}
