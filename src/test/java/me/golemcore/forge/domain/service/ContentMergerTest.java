package me.golemcore.forge.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentMergerTest {

    private ContentMerger merger;

    @BeforeEach
    void setUp() {
        merger = new ContentMerger();
    }

    @Test
    void shouldReturnEqualCopyForEmptyPatch() {
        Map<String, Object> base = document();

        Map<String, Object> merged = merger.merge(base, Map.of());

        assertEquals(base, merged);
        assertNotSame(base, merged);
    }

    @Test
    void shouldDeleteKeyOnNullWhetherPresentOrNot() {
        Map<String, Object> patch = new HashMap<>();
        patch.put("tone", null);
        patch.put("missing", null);

        Map<String, Object> merged = merger.merge(document(), patch);

        assertFalse(merged.containsKey("tone"));
        assertFalse(merged.containsKey("missing"));
        assertTrue(merged.containsKey("rules"));
    }

    @Test
    void shouldMergeNestedObjectsRecursively() {
        Map<String, Object> patch = Map.of("settings", Map.of("temperature", 0.2, "style", "terse"));

        Map<String, Object> merged = merger.merge(document(), patch);

        @SuppressWarnings("unchecked")
        Map<String, Object> settings = (Map<String, Object>) merged.get("settings");
        assertEquals(0.2, settings.get("temperature"));
        assertEquals(512, settings.get("maxTokens"));
        assertEquals("terse", settings.get("style"));
    }

    @Test
    void shouldReplaceArraysWholesale() {
        Map<String, Object> merged = merger.merge(document(), Map.of("rules", List.of("only this")));

        assertEquals(List.of("only this"), merged.get("rules"));
    }

    @Test
    void shouldReplaceObjectWithScalar() {
        Map<String, Object> merged = merger.merge(document(), Map.of("settings", "default"));

        assertEquals("default", merged.get("settings"));
    }

    @Test
    void shouldDeleteNestedKeyOnNull() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("maxTokens", null);

        Map<String, Object> merged = merger.merge(document(), Map.of("settings", nested));

        @SuppressWarnings("unchecked")
        Map<String, Object> settings = (Map<String, Object>) merged.get("settings");
        assertFalse(settings.containsKey("maxTokens"));
        assertEquals(0.7, settings.get("temperature"));
    }

    @Test
    void shouldNotMutateBase() {
        Map<String, Object> base = document();
        Map<String, Object> snapshot = document();

        merger.merge(base, Map.of("settings", Map.of("temperature", 1.0), "tone", "dry"));

        assertEquals(snapshot, base);
    }

    @Test
    void shouldTreatNullPatchAsEmpty() {
        assertEquals(document(), merger.merge(document(), null));
    }

    private static Map<String, Object> document() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("temperature", 0.7);
        settings.put("maxTokens", 512);
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("tone", "friendly");
        doc.put("rules", List.of("be brief", "cite sources"));
        doc.put("settings", settings);
        return doc;
    }
}
