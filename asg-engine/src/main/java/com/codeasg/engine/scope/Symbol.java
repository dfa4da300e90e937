package com.codeasg.engine.scope;

import java.util.List;

/**
 * A declared name.
 *
 * @param declNode  AST node of the declaring occurrence
 * @param uses      other occurrences bound to this symbol, reads and writes alike, in source order
 */
public record Symbol(int id, String name, SymbolKind kind, int scopeId, int declNode, List<Integer> uses) {

    public Symbol {
        uses = List.copyOf(uses);
    }
}
