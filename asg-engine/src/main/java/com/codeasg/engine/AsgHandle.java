package com.codeasg.engine;

import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.graph.Asg;

/**
 * Caller-side reference to a built graph. Stays valid after the cache evicts or replaces it.
 */
public final class AsgHandle {

    private final Asg asg;

    AsgHandle(Asg asg) {
        this.asg = asg;
    }

    public String identity() { return asg.identity(); }

    public String contentHash() { return asg.contentHash(); }

    public Language language() { return asg.language(); }

    /** True when the unit had syntax errors and the graph covers only what could be recovered. */
    public boolean degraded() { return asg.isDegraded(); }

    public Asg asg() { return asg; }

    @Override
    public String toString() {
        return "AsgHandle[" + asg.language() + "::" + asg.identity() + ", " + asg.contentHash()
            + (degraded() ? ", degraded" : "") + "]";
    }
}
