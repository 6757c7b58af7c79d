package me.golemcore.forge.adapter.outbound.storage;

import me.golemcore.forge.infrastructure.config.ForgeAutoConfiguration;
import me.golemcore.forge.infrastructure.config.ForgeProperties;
import me.golemcore.forge.port.outbound.RecordQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileRecordStoreAdapterTest {

    private static final String VERSIONS = "prompt_versions";

    @TempDir
    Path tempDir;

    private ForgeProperties properties;
    private JsonFileRecordStoreAdapter store;

    @BeforeEach
    void setUp() {
        properties = new ForgeProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.resolve("store").toString());
        store = newStore();
    }

    @Test
    void insert_writesCollectionFile() throws Exception {
        store.insert(VERSIONS, Map.of("promptId", "p1", "version", 1)).join();

        Path file = tempDir.resolve("store").resolve(VERSIONS + ".json");
        assertTrue(Files.exists(file));
        assertTrue(Files.readString(file).contains("\"promptId\" : \"p1\""));
        assertFalse(Files.exists(tempDir.resolve("store").resolve(VERSIONS + ".json.tmp")));
    }

    @Test
    void recordsSurviveRestart() {
        Map<String, Object> stored = store.insert(VERSIONS, Map.of("promptId", "p1", "version", 1)).join();
        store.update(VERSIONS, (String) stored.get("id"), Map.of("message", "edited")).join();
        store.insert("prompts", Map.of("slug", "one")).join();

        JsonFileRecordStoreAdapter reopened = newStore();

        List<Map<String, Object>> versions = reopened.select(VERSIONS, RecordQuery.all()).join();
        assertEquals(1, versions.size());
        assertEquals("edited", versions.get(0).get("message"));
        assertEquals(1, reopened.select("prompts", RecordQuery.all()).join().size());
    }

    @Test
    void delete_isPersisted() {
        Map<String, Object> stored = store.insert(VERSIONS, Map.of("promptId", "p1")).join();
        store.delete(VERSIONS, (String) stored.get("id")).join();

        assertTrue(newStore().select(VERSIONS, RecordQuery.all()).join().isEmpty());
    }

    @Test
    void init_resolvesBasePath() {
        assertEquals(tempDir.resolve("store").toAbsolutePath().normalize(), store.getBasePath());
    }

    @Test
    void rejectsCollectionNamesEscapingBasePath() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> store.insert("../outside", Map.of("a", 1)).join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertTrue(store.select("../outside", RecordQuery.all()).join().isEmpty());
    }

    @Test
    void failedInsertLeavesNothingBehind() throws Exception {
        breakBaseDirectory();

        CompletionException error = assertThrows(CompletionException.class,
                () -> store.insert(VERSIONS, Map.of("promptId", "p1", "version", 1)).join());

        assertInstanceOf(UncheckedIOException.class, error.getCause());
        assertTrue(store.select(VERSIONS, RecordQuery.all()).join().isEmpty());
    }

    @Test
    void failedUpdateKeepsPreviousRecord() throws Exception {
        Map<String, Object> stored = store.insert(VERSIONS, Map.of("promptId", "p1", "message", "first")).join();
        String id = (String) stored.get("id");
        breakBaseDirectory();

        assertThrows(CompletionException.class, () -> store.update(VERSIONS, id, Map.of("message", "second")).join());

        List<Map<String, Object>> records = store.select(VERSIONS, RecordQuery.all()).join();
        assertEquals(1, records.size());
        assertEquals("first", records.get(0).get("message"));
    }

    @Test
    void failedDeleteKeepsRecord() throws Exception {
        Map<String, Object> stored = store.insert(VERSIONS, Map.of("promptId", "p1")).join();
        breakBaseDirectory();

        assertThrows(CompletionException.class, () -> store.delete(VERSIONS, (String) stored.get("id")).join());

        assertEquals(1, store.select(VERSIONS, RecordQuery.all()).join().size());
    }

    private void breakBaseDirectory() throws IOException {
        Path base = store.getBasePath();
        try (Stream<Path> files = Files.list(base)) {
            for (Path file : files.toList()) {
                Files.delete(file);
            }
        }
        Files.delete(base);
        Files.writeString(base, "not a directory");
    }

    private JsonFileRecordStoreAdapter newStore() {
        JsonFileRecordStoreAdapter adapter = new JsonFileRecordStoreAdapter(Clock.systemUTC(), properties,
                ForgeAutoConfiguration.objectMapper());
        adapter.init();
        return adapter;
    }
}
