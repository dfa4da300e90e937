package com.codeasg.engine.cfg;

import com.codeasg.engine.ast.AstNode;

import java.util.List;

/**
 * All control-flow graphs of one unit plus the synthetic entry/exit nodes they introduced.
 * The module-level graph comes first.
 */
public record FlowGraphs(List<ControlFlowGraph> graphs, List<AstNode> syntheticNodes) {

    public FlowGraphs {
        graphs = List.copyOf(graphs);
        syntheticNodes = List.copyOf(syntheticNodes);
    }

    /** Graph owned by the given function-like node (or the root), or null. */
    public ControlFlowGraph forFunction(int functionNode) {
        for (ControlFlowGraph graph : graphs) {
            if (graph.functionNode() == functionNode) return graph;
        }
        return null;
    }
}
