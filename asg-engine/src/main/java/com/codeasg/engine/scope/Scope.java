package com.codeasg.engine.scope;

import java.util.List;

/**
 * A lexical region introducing names.
 *
 * @param parent     enclosing scope id, -1 for the module scope
 * @param ownerNode  AST node that opened the scope
 * @param symbols    ids of symbols declared directly in this scope, in declaration order
 */
public record Scope(int id, ScopeKind kind, int parent, int ownerNode, List<Integer> symbols) {

    public Scope {
        symbols = List.copyOf(symbols);
    }
}
