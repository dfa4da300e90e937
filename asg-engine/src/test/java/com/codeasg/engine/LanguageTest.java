package com.codeasg.engine;

import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.grammar.LanguageDetector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LanguageTest {

    @Test
    void resolvesCanonicalIds() {
        for (Language language : Language.values()) {
            assertEquals(language, Language.fromId(language.id()));
        }
        assertEquals(8, Language.ids().size());
    }

    @Test
    void resolvesAliasesCaseInsensitively() {
        assertEquals(Language.PYTHON, Language.fromId("py"));
        assertEquals(Language.JAVASCRIPT, Language.fromId("JS"));
        assertEquals(Language.CPP, Language.fromId("c++"));
        assertEquals(Language.GO, Language.fromId("golang"));
        assertEquals(Language.RUST, Language.fromId("rs"));
    }

    @Test
    void unknownLanguageIsRejected() {
        Language.UnsupportedLanguageException e = assertThrows(Language.UnsupportedLanguageException.class,
            () -> Language.fromId("cobol"));
        assertEquals("cobol", e.getLanguageId());
    }

    @Test
    void detectsLanguageFromExtension() {
        assertEquals(Language.PYTHON, LanguageDetector.detect("", "tool.py"));
        assertEquals(Language.TYPESCRIPT, LanguageDetector.detect("", "app.ts"));
        assertEquals(Language.JAVASCRIPT, LanguageDetector.detect("", "app.jsx"));
        assertEquals(Language.GO, LanguageDetector.detect("", "main.go"));
        assertEquals(Language.RUST, LanguageDetector.detect("", "lib.rs"));
        assertEquals(Language.C, LanguageDetector.detect("", "buffer.c"));
        assertEquals(Language.CPP, LanguageDetector.detect("", "matrix.cpp"));
        assertEquals(Language.JAVA, LanguageDetector.detect("", "Ledger.java"));
    }

    @Test
    void detectsLanguageFromContentWithoutFileName() {
        assertEquals(Language.GO, LanguageDetector.detect("package main\n\nfunc main() {}\n", null));
        assertEquals(Language.PYTHON, LanguageDetector.detect("def f():\n    return 1\n", null));
    }
}
