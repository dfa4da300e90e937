package com.codeasg.engine.grammar;

import org.treesitter.TreeSitterC;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterGo;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterRust;
import org.treesitter.TreeSitterTypescript;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each enabled {@link Language} to the adapter that parses it.
 */
public class GrammarRegistry {

    private final Map<Language, GrammarAdapter> adapters = new EnumMap<>(Language.class);

    /** Registry with the bundled tree-sitter grammar for every language in {@code enabled}. */
    public static GrammarRegistry treeSitter(Collection<Language> enabled) {
        GrammarRegistry registry = new GrammarRegistry();
        for (Language language : enabled) {
            registry.register(treeSitterAdapter(language));
        }
        return registry;
    }

    public static GrammarRegistry treeSitter() {
        return treeSitter(List.of(Language.values()));
    }

    static GrammarAdapter treeSitterAdapter(Language language) {
        return switch (language) {
            case PYTHON -> new TreeSitterGrammarAdapter(language, TreeSitterPython::new);
            case JAVASCRIPT -> new TreeSitterGrammarAdapter(language, TreeSitterJavascript::new);
            case TYPESCRIPT -> new TreeSitterGrammarAdapter(language, TreeSitterTypescript::new);
            case GO -> new TreeSitterGrammarAdapter(language, TreeSitterGo::new);
            case RUST -> new TreeSitterGrammarAdapter(language, TreeSitterRust::new);
            case C -> new TreeSitterGrammarAdapter(language, TreeSitterC::new);
            case CPP -> new TreeSitterGrammarAdapter(language, TreeSitterCpp::new);
            case JAVA -> new TreeSitterGrammarAdapter(language, TreeSitterJava::new);
        };
    }

    public GrammarRegistry register(GrammarAdapter adapter) {
        adapters.put(adapter.language(), adapter);
        return this;
    }

    public boolean supports(Language language) {
        return adapters.containsKey(language);
    }

    public List<Language> languages() {
        return new ArrayList<>(adapters.keySet());
    }

    /**
     * Parses source text with the adapter registered for {@code language}.
     *
     * @throws Language.UnsupportedLanguageException if no adapter is registered
     */
    public RawTree parse(SourceText source, Language language) {
        GrammarAdapter adapter = adapters.get(language);
        if (adapter == null) {
            throw new Language.UnsupportedLanguageException(language.id());
        }
        return adapter.parse(source);
    }
}
