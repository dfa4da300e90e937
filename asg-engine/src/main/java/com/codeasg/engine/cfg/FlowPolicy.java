package com.codeasg.engine.cfg;

import com.codeasg.engine.grammar.Language;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Control-flow rules that differ between languages.
 *
 * @param switchFallthrough  a case without a jump continues into the next case
 * @param callsMayThrow      any call may raise, so blocks with calls get exception edges
 * @param abortingCalls      callee names that never return normally (panics)
 * @param raisingKinds       raw expression kinds that may leave the function early
 */
public record FlowPolicy(
    boolean switchFallthrough,
    boolean callsMayThrow,
    Set<String> abortingCalls,
    Set<String> raisingKinds
) {

    private static final Map<Language, FlowPolicy> POLICIES = new EnumMap<>(Language.class);

    static {
        FlowPolicy cFamily = new FlowPolicy(true, false, Set.of(), Set.of());
        POLICIES.put(Language.PYTHON, new FlowPolicy(false, false, Set.of(), Set.of()));
        POLICIES.put(Language.JAVASCRIPT, cFamily);
        POLICIES.put(Language.TYPESCRIPT, cFamily);
        POLICIES.put(Language.C, cFamily);
        POLICIES.put(Language.CPP, cFamily);
        POLICIES.put(Language.JAVA, new FlowPolicy(true, true, Set.of(), Set.of()));
        POLICIES.put(Language.GO, new FlowPolicy(false, false, Set.of("panic"), Set.of()));
        POLICIES.put(Language.RUST, new FlowPolicy(false, false,
            Set.of("panic", "unreachable", "todo", "unimplemented"), Set.of("try_expression")));
    }

    public static FlowPolicy forLanguage(Language language) {
        return POLICIES.get(language);
    }
}
