package com.codeasg.engine.grammar;

import java.util.Locale;
import java.util.Map;

/**
 * Guesses the language of a source unit from its file name, falling back to keyword heuristics.
 */
public final class LanguageDetector {

    private static final Map<String, Language> EXTENSIONS = Map.ofEntries(
        Map.entry("py", Language.PYTHON),
        Map.entry("pyi", Language.PYTHON),
        Map.entry("js", Language.JAVASCRIPT),
        Map.entry("jsx", Language.JAVASCRIPT),
        Map.entry("mjs", Language.JAVASCRIPT),
        Map.entry("cjs", Language.JAVASCRIPT),
        Map.entry("ts", Language.TYPESCRIPT),
        Map.entry("go", Language.GO),
        Map.entry("rs", Language.RUST),
        Map.entry("c", Language.C),
        Map.entry("h", Language.C),
        Map.entry("cpp", Language.CPP),
        Map.entry("cc", Language.CPP),
        Map.entry("cxx", Language.CPP),
        Map.entry("hpp", Language.CPP),
        Map.entry("hh", Language.CPP),
        Map.entry("java", Language.JAVA)
    );

    private LanguageDetector() {}

    public static Language detect(String source, String fileName) {
        if (fileName != null) {
            int dot = fileName.lastIndexOf('.');
            if (dot >= 0) {
                Language byExtension = EXTENSIONS.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
                if (byExtension != null) return byExtension;
            }
        }
        return fromContent(source != null ? source : "");
    }

    // Order matters: earlier rules are more specific.
    static Language fromContent(String code) {
        if (code.contains("def ") && code.contains(":") && code.contains("import ")) return Language.PYTHON;
        if (code.contains("func ") && code.contains("{") && code.contains("package ")) return Language.GO;
        if (code.contains("fn ") && code.contains("let ") && code.contains("->")) return Language.RUST;
        if (code.contains("class ") && code.contains("public ") && code.contains("void ")) return Language.JAVA;
        if (code.contains("std::") || code.contains("template<") || code.contains("template <")) return Language.CPP;
        if (code.contains("#include") && code.contains("int ")) return Language.C;
        if (code.contains("interface ") && code.contains(": ") && code.contains("=>")) return Language.TYPESCRIPT;
        if (code.contains("function") || code.contains("=>") || code.contains("var ")) return Language.JAVASCRIPT;
        return Language.PYTHON;
    }
}
