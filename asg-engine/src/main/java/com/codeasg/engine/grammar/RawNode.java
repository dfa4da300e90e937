package com.codeasg.engine.grammar;

import java.util.List;

/**
 * One node of a grammar's concrete syntax tree, in the same shape for every language.
 *
 * @param kind      grammar-specific node kind ("if_statement", "ERROR", "}")
 * @param named     false for anonymous tokens such as punctuation and keywords
 * @param error     true for tolerant-parse error nodes covering malformed input
 * @param missing   true for zero-width tokens the parser inserted to recover
 * @param field     field name under which the parent holds this node, or null
 */
public record RawNode(
    String kind,
    boolean named,
    boolean error,
    boolean missing,
    String field,
    int startByte,
    int endByte,
    TextPoint start,
    TextPoint end,
    List<RawNode> children
) {

    public RawNode {
        children = List.copyOf(children);
    }

    public boolean isLeaf() { return children.isEmpty(); }
}
