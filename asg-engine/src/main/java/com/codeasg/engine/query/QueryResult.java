package com.codeasg.engine.query;

import com.codeasg.engine.ast.AstNode;

import java.util.List;

/**
 * Bounded result set of a query.
 *
 * @param degraded   the start node or a result overlaps a syntax error region
 * @param truncated  the result bound was hit before the traversal finished
 */
public record QueryResult(List<AstNode> nodes, boolean degraded, boolean truncated) {

    public QueryResult {
        nodes = List.copyOf(nodes);
    }

    public List<Integer> ids() {
        return nodes.stream().map(AstNode::id).toList();
    }

    public int size() { return nodes.size(); }

    public boolean isEmpty() { return nodes.isEmpty(); }
}
