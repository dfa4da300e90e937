package com.codeasg.engine.grammar;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Concrete syntax tree for one source unit, as returned by a {@link GrammarAdapter}.
 */
public record RawTree(Language language, SourceText source, RawNode root) {

    /** True if any ERROR or MISSING node occurs anywhere in the tree. */
    public boolean hasErrors() {
        Deque<RawNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            RawNode node = pending.pop();
            if (node.error() || node.missing()) return true;
            for (RawNode child : node.children()) pending.push(child);
        }
        return false;
    }

    /** Number of raw nodes, anonymous tokens included. */
    public int size() {
        int count = 0;
        Deque<RawNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            RawNode node = pending.pop();
            count++;
            for (RawNode child : node.children()) pending.push(child);
        }
        return count;
    }
}
