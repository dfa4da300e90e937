package com.codeasg.engine;

import com.codeasg.engine.config.EngineConfig;
import com.codeasg.engine.config.EngineConfigReader;
import com.codeasg.engine.config.EngineConfigReader.ConfigReadException;
import com.codeasg.engine.grammar.Language;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigReaderTest {

    @TempDir
    Path tempDir;

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("asg-engine.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void readsAllFields() throws IOException {
        Path file = write("{\n"
            + "  \"cache_max_entries\": 12,\n"
            + "  \"worker_threads\": 3,\n"
            + "  \"query_max_results\": 50,\n"
            + "  \"query_timeout_millis\": 250,\n"
            + "  \"languages\": [\"Python\", \"go\", \"python\"]\n"
            + "}\n");
        EngineConfig config = new EngineConfigReader().read(file);
        assertEquals(12, config.getCacheMaxEntries());
        assertEquals(3, config.getWorkerThreads());
        assertEquals(50, config.getQueryMaxResults());
        assertEquals(250, config.getQueryTimeoutMillis());
        assertEquals(List.of(Language.PYTHON, Language.GO), config.enabledLanguages());
    }

    @Test
    void missingFieldsFallBackToDefaults() throws IOException {
        EngineConfig config = new EngineConfigReader().read(write("{}"));
        assertEquals(EngineConfig.DEFAULT_CACHE_MAX_ENTRIES, config.getCacheMaxEntries());
        assertEquals(EngineConfig.DEFAULT_QUERY_MAX_RESULTS, config.getQueryMaxResults());
        assertEquals(EngineConfig.DEFAULT_QUERY_TIMEOUT_MILLIS, config.getQueryTimeoutMillis());
        assertTrue(config.getWorkerThreads() > 0);
        assertEquals(Language.values().length, config.enabledLanguages().size());
    }

    @Test
    void missingFileIsReported() {
        ConfigReadException e = assertThrows(ConfigReadException.class,
            () -> new EngineConfigReader().read(tempDir.resolve("nope.json")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void malformedJsonIsReported() throws IOException {
        Path file = write("{ \"cache_max_entries\": ");
        assertThrows(ConfigReadException.class, () -> new EngineConfigReader().read(file));
    }

    @Test
    void emptyFileIsReported() throws IOException {
        Path file = write("");
        ConfigReadException e = assertThrows(ConfigReadException.class, () -> new EngineConfigReader().read(file));
        assertTrue(e.getMessage().contains("empty"));
    }

    @Test
    void nonPositiveLimitsAreRejected() throws IOException {
        Path file = write("{\"cache_max_entries\": 0}");
        ConfigReadException e = assertThrows(ConfigReadException.class, () -> new EngineConfigReader().read(file));
        assertTrue(e.getMessage().contains("cache_max_entries"));
    }

    @Test
    void unknownLanguageFailsWhenEnabled() throws IOException {
        EngineConfig config = new EngineConfigReader().read(write("{\"languages\": [\"cobol\"]}"));
        assertThrows(Language.UnsupportedLanguageException.class, config::enabledLanguages);
    }

    @Test
    void bundledDefaultEnablesEveryLanguage() {
        EngineConfig config = new EngineConfigReader().readDefault();
        assertEquals(256, config.getCacheMaxEntries());
        assertEquals(Language.values().length, config.enabledLanguages().size());
    }

    @Test
    void withersCopy() {
        EngineConfig base = EngineConfig.defaults();
        EngineConfig small = base.withCacheMaxEntries(4).withLanguages(List.of("rust"));
        assertEquals(4, small.getCacheMaxEntries());
        assertEquals(List.of(Language.RUST), small.enabledLanguages());
        assertEquals(EngineConfig.DEFAULT_CACHE_MAX_ENTRIES, base.getCacheMaxEntries());
        assertTrue(base.getLanguages().isEmpty());
    }
}
