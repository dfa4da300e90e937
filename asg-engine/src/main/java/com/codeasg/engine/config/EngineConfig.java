package com.codeasg.engine.config;

import com.codeasg.engine.grammar.Language;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of the engine configuration file (asg-engine.json).
 * Every field is optional; getters fall back to defaults.
 */
public class EngineConfig {

    public static final int DEFAULT_CACHE_MAX_ENTRIES = 256;
    public static final int DEFAULT_QUERY_MAX_RESULTS = 10_000;
    public static final long DEFAULT_QUERY_TIMEOUT_MILLIS = 5_000;

    /** Maximum number of unit graphs kept in the graph cache (default: 256). */
    @SerializedName("cache_max_entries")
    private Integer cacheMaxEntries;

    /** Size of the pool used for asynchronous builds (default: available processors). */
    @SerializedName("worker_threads")
    private Integer workerThreads;

    @SerializedName("query_max_results")
    private Integer queryMaxResults;

    @SerializedName("query_timeout_millis")
    private Long queryTimeoutMillis;

    /** Language ids to load grammars for (default: all supported). */
    @SerializedName("languages")
    private List<String> languages;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public int getCacheMaxEntries()     { return cacheMaxEntries != null ? cacheMaxEntries : DEFAULT_CACHE_MAX_ENTRIES; }
    public int getWorkerThreads() {
        return workerThreads != null ? workerThreads : Runtime.getRuntime().availableProcessors();
    }
    public int getQueryMaxResults()     { return queryMaxResults != null ? queryMaxResults : DEFAULT_QUERY_MAX_RESULTS; }
    public long getQueryTimeoutMillis() {
        return queryTimeoutMillis != null ? queryTimeoutMillis : DEFAULT_QUERY_TIMEOUT_MILLIS;
    }
    public List<String> getLanguages()  { return languages != null ? languages : Collections.emptyList(); }

    /**
     * Languages enabled by this configuration.
     *
     * @throws Language.UnsupportedLanguageException if an id is not a supported language
     */
    public List<Language> enabledLanguages() {
        if (languages == null || languages.isEmpty()) return Arrays.asList(Language.values());
        List<Language> enabled = new ArrayList<>();
        for (String id : languages) {
            Language language = Language.fromId(id);
            if (!enabled.contains(language)) enabled.add(language);
        }
        return enabled;
    }

    public EngineConfig withCacheMaxEntries(int value) {
        EngineConfig copy = copy();
        copy.cacheMaxEntries = value;
        return copy;
    }

    public EngineConfig withLanguages(List<String> value) {
        EngineConfig copy = copy();
        copy.languages = new ArrayList<>(value);
        return copy;
    }

    private EngineConfig copy() {
        EngineConfig copy = new EngineConfig();
        copy.cacheMaxEntries = cacheMaxEntries;
        copy.workerThreads = workerThreads;
        copy.queryMaxResults = queryMaxResults;
        copy.queryTimeoutMillis = queryTimeoutMillis;
        copy.languages = languages;
        return copy;
    }
}
