package com.codeasg.engine.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Languages the engine can build graphs for.
 * Lookup accepts the canonical id and a few common aliases ("py", "js", "c++", ...).
 */
public enum Language {

    PYTHON("python", "py", "python3"),
    JAVASCRIPT("javascript", "js", "jsx", "mjs", "cjs"),
    TYPESCRIPT("typescript", "ts"),
    GO("go", "golang"),
    RUST("rust", "rs"),
    C("c", "h"),
    CPP("cpp", "c++", "cc", "cxx", "hpp"),
    JAVA("java");

    private final String id;
    private final Set<String> aliases;

    Language(String id, String... aliases) {
        this.id = id;
        this.aliases = Set.of(aliases);
    }

    public String id() { return id; }

    public Set<String> aliases() { return aliases; }

    /**
     * Resolves a language identifier.
     *
     * @throws UnsupportedLanguageException if the id is neither a canonical id nor a known alias
     */
    public static Language fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new UnsupportedLanguageException(String.valueOf(id));
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.id.equals(normalized) || language.aliases.contains(normalized)) {
                return language;
            }
        }
        throw new UnsupportedLanguageException(id);
    }

    public static List<String> ids() {
        List<String> ids = new ArrayList<>();
        for (Language language : values()) ids.add(language.id);
        return Collections.unmodifiableList(ids);
    }

    @Override
    public String toString() { return id; }

    /**
     * Terminal: retrying with the same language id can never succeed.
     */
    public static class UnsupportedLanguageException extends RuntimeException {
        private final String languageId;

        public UnsupportedLanguageException(String languageId) {
            super("Unsupported language: " + languageId + ". Supported: " + String.join(", ", ids()));
            this.languageId = languageId;
        }

        public String getLanguageId() { return languageId; }
    }
}
