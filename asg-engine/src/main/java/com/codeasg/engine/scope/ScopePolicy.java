package com.codeasg.engine.scope;

import com.codeasg.engine.grammar.Language;

import java.util.EnumMap;
import java.util.Map;

/**
 * Name-resolution rules that differ between languages.
 *
 * @param blockScoped                 braces and loop headers open scopes
 * @param orderedLookup               a use sees only declarations that precede it, else the one outside
 * @param classMembersVisibleInMethods methods see class members unqualified (Java, C++)
 * @param implicitDeclaration         assignment to an unknown name declares it in the function (Python)
 * @param implicitGlobals             write to an unknown name creates a module-level variable (JavaScript)
 * @param hoistsVar                   {@code var} declarations belong to the enclosing function
 */
public record ScopePolicy(
    boolean blockScoped,
    boolean orderedLookup,
    boolean classMembersVisibleInMethods,
    boolean implicitDeclaration,
    boolean implicitGlobals,
    boolean hoistsVar
) {

    private static final Map<Language, ScopePolicy> POLICIES = new EnumMap<>(Language.class);

    static {
        ScopePolicy script = new ScopePolicy(true, false, false, false, true, true);
        ScopePolicy lexical = new ScopePolicy(true, true, false, false, false, false);
        ScopePolicy classBased = new ScopePolicy(true, true, true, false, false, false);
        POLICIES.put(Language.PYTHON, new ScopePolicy(false, false, false, true, false, false));
        POLICIES.put(Language.JAVASCRIPT, script);
        POLICIES.put(Language.TYPESCRIPT, script);
        POLICIES.put(Language.GO, lexical);
        POLICIES.put(Language.RUST, lexical);
        POLICIES.put(Language.C, lexical);
        POLICIES.put(Language.CPP, classBased);
        POLICIES.put(Language.JAVA, classBased);
    }

    public static ScopePolicy forLanguage(Language language) {
        return POLICIES.get(language);
    }

    /** Redeclaring a name in the same scope reuses the existing symbol. */
    public boolean mergesRedeclarations() {
        return implicitDeclaration || hoistsVar;
    }
}
