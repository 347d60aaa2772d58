package com.nfv.structmatch.config;

import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test ignore pattern matching on tree paths
 */
class PathPatternsTest {

    @Test
    @DisplayName("Exact patterns also cover nested keys and indexes")
    void testExactAndAutoPrefix() {
        assertTrue(PathPatterns.matches("metadata.annotations", "metadata.annotations"));
        assertTrue(PathPatterns.matches("metadata.annotations.key", "metadata.annotations"));
        assertTrue(PathPatterns.matches("metadata.annotations[0]", "metadata.annotations"));
        assertFalse(PathPatterns.matches("metadata.annotationsExtra", "metadata.annotations"),
                "Auto-prefix only applies at path boundaries");
        assertFalse(PathPatterns.matches("metadata", "metadata.annotations"));
    }

    @Test
    @DisplayName("Prefix patterns with * or .*")
    void testPrefix() {
        assertTrue(PathPatterns.matches("status", "status.*"));
        assertTrue(PathPatterns.matches("status.phase", "status.*"));
        assertTrue(PathPatterns.matches("status.conditions[1].type", "status*"));
        assertFalse(PathPatterns.matches("statusCode", "status.*"));
    }

    @Test
    @DisplayName("Suffix and contains patterns")
    void testSuffixAndContains() {
        assertTrue(PathPatterns.matches("metadata.uid", "*.uid"));
        assertTrue(PathPatterns.matches("spec.template.metadata.uid", "*metadata.uid"));
        assertFalse(PathPatterns.matches("metadata.uid.value", "*.uid"));

        assertTrue(PathPatterns.matches("spec.secretToken.value", "*Token*"));
        assertTrue(PathPatterns.matches("spec.template.metadata.creationTimestamp", ".*creationTimestamp.*"));
        assertFalse(PathPatterns.matches("spec.replicas", "*Token*"));
    }

    @Test
    @DisplayName("Blank patterns never match and a lone wildcard matches everything")
    void testEdgeCases() {
        assertFalse(PathPatterns.matches("spec", ""));
        assertFalse(PathPatterns.matches("spec", null));
        assertFalse(PathPatterns.matches(null, "spec"));
        assertTrue(PathPatterns.matches("anything[3]", "*"));

        assertTrue(PathPatterns.matchesAny("metadata.uid", Arrays.asList("", null, "metadata.uid")));
        assertFalse(PathPatterns.matchesAny("metadata.uid", null));
        assertFalse(PathPatterns.matchesAny("metadata.uid", Collections.emptyList()));
    }
}
