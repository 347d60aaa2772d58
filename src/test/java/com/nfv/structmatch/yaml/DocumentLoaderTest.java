package com.nfv.structmatch.yaml;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

import static com.nfv.structmatch.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DocumentLoaderTest {

    private final DocumentLoader loader = new DocumentLoader();

    static String resource(String name) throws Exception {
        return Paths.get(DocumentLoaderTest.class.getResource("/documents/" + name).toURI()).toString();
    }

    @Test
    @DisplayName("YAML documents are read into maps and lists")
    @SuppressWarnings("unchecked")
    void testLoadYaml() throws Exception {
        Map<String, Object> deployment = (Map<String, Object>) loader.load(resource("deployment-actual.yaml"));

        assertEquals("Deployment", deployment.get("kind"));
        Map<String, Object> spec = (Map<String, Object>) deployment.get("spec");
        assertEquals(3, spec.get("replicas"));
    }

    @Test
    @DisplayName("JSON documents are read with the JSON parser")
    void testLoadJson() throws Exception {
        Object events = loader.load(resource("events.json"));

        assertEquals(map("id", "evt-1", "createdAt", "2024-03-01T10:00:00.400Z", "tags", list("a", "b")), events);
    }

    @Test
    @DisplayName("Multi-document YAML becomes a list of documents")
    void testMultiDocument() throws Exception {
        assertEquals(list(map("color", "red"), map("color", "blue")), loader.load(resource("multi.yaml")));
    }

    @Test
    @DisplayName("Missing paths, directories and broken files raise IOException")
    void testErrors(@TempDir Path tempDir) throws Exception {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("missing.yaml").toString()));
        assertThrows(IOException.class, () -> loader.load(tempDir.toString()));
        assertThrows(IOException.class, () -> loader.load(resource("broken.json")));

        Path empty = tempDir.resolve("empty.yaml");
        Files.writeString(empty, "# nothing here\n");
        assertNull(loader.load(empty.toString()));
    }

    @Test
    @DisplayName("Trees render as JSON or YAML")
    void testRender() throws Exception {
        Object tree = map("color", "red", "tags", list("a"));

        String json = loader.render(tree, "json");
        assertTrue(json.contains("\"color\" : \"red\""), json);

        String yaml = loader.render(tree, "YAML");
        assertTrue(yaml.contains("color: \"red\""), yaml);
        assertTrue(yaml.contains("- \"a\""), yaml);

        assertThrows(IllegalArgumentException.class, () -> loader.render(tree, "xml"));
    }
}
