package com.codeasg.engine.cfg;

import java.util.List;

/**
 * Maximal straight-line run of statement items. Ids are local to one CFG; entry is 0, exit is 1.
 *
 * @param items        AST node ids in execution order
 * @param unreachable  no path from the entry reaches this block
 */
public record BasicBlock(int id, List<Integer> items, boolean synthetic, boolean unreachable) {

    public BasicBlock {
        items = List.copyOf(items);
    }

    public boolean isEmpty() { return items.isEmpty(); }

    public int first() { return items.get(0); }

    public int last() { return items.get(items.size() - 1); }
}
