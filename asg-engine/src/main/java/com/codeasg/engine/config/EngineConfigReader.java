package com.codeasg.engine.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class EngineConfigReader {

    /** Classpath resource read by {@link #readDefault()}. */
    public static final String RESOURCE = "asg-engine.json";

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes an engine configuration file.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public EngineConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            return parse(reader, configPath.toString());
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads {@value #RESOURCE} from the classpath, or returns {@link EngineConfig#defaults()} when absent.
     */
    public EngineConfig readDefault() {
        InputStream in = EngineConfigReader.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            return EngineConfig.defaults();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, "classpath:" + RESOURCE);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: classpath:" + RESOURCE + ": " + e.getMessage(), e);
        }
    }

    private static EngineConfig parse(Reader reader, String origin) {
        EngineConfig config;
        try {
            config = GSON.fromJson(reader, EngineConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + origin, e);
        }
        if (config == null) {
            throw new ConfigReadException("Config file is empty or invalid JSON: " + origin);
        }
        if (config.getCacheMaxEntries() <= 0) {
            throw new ConfigReadException("cache_max_entries must be positive in " + origin);
        }
        if (config.getWorkerThreads() <= 0) {
            throw new ConfigReadException("worker_threads must be positive in " + origin);
        }
        if (config.getQueryMaxResults() <= 0 || config.getQueryTimeoutMillis() <= 0) {
            throw new ConfigReadException("query limits must be positive in " + origin);
        }
        return config;
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
