package com.codeasg.engine.scope;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of name resolution for one unit: scopes, symbols and the binding of every
 * identifier occurrence that resolved.
 */
public final class SymbolTable {

    private final List<Scope> scopes;
    private final List<Symbol> symbols;
    private final int[] scopeOfNode;
    private final Map<Integer, AccessMode> access;
    private final Map<Integer, Integer> bindings;
    private final List<Integer> unresolved;

    SymbolTable(List<Scope> scopes, List<Symbol> symbols, int[] scopeOfNode, Map<Integer, AccessMode> access,
                Map<Integer, Integer> bindings, List<Integer> unresolved) {
        this.scopes = List.copyOf(scopes);
        this.symbols = List.copyOf(symbols);
        this.scopeOfNode = scopeOfNode.clone();
        this.access = Collections.unmodifiableMap(access);
        this.bindings = Collections.unmodifiableMap(bindings);
        this.unresolved = List.copyOf(unresolved);
    }

    public List<Scope> scopes() { return scopes; }

    public List<Symbol> symbols() { return symbols; }

    public Scope scope(int id) { return scopes.get(id); }

    public Symbol symbol(int id) { return symbols.get(id); }

    /** Innermost scope containing the node. */
    public int scopeOf(int nodeId) {
        return nodeId < scopeOfNode.length ? scopeOfNode[nodeId] : 0;
    }

    /** Access mode of a variable occurrence, or null when the node is not one. */
    public AccessMode accessOf(int nodeId) {
        return access.get(nodeId);
    }

    /** Symbol id the occurrence is bound to, or null if unbound. */
    public Integer bindingOf(int nodeId) {
        return bindings.get(nodeId);
    }

    public Map<Integer, Integer> bindings() { return bindings; }

    public Map<Integer, AccessMode> accesses() { return access; }

    /** Occurrences that could not be resolved, in source order. */
    public List<Integer> unresolved() { return unresolved; }
}
