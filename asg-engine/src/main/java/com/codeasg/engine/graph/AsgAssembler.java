package com.codeasg.engine.graph;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.cfg.ControlFlowGraph;
import com.codeasg.engine.cfg.FlowGraphs;
import com.codeasg.engine.cfg.StatementEdge;
import com.codeasg.engine.dfg.DataFlow;
import com.codeasg.engine.dfg.DefUse;
import com.codeasg.engine.scope.AccessMode;
import com.codeasg.engine.scope.Scope;
import com.codeasg.engine.scope.Symbol;
import com.codeasg.engine.scope.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the AST, scopes, control flow and data flow of one unit into an {@link Asg}.
 */
public class AsgAssembler {

    public Asg assemble(String identity, String contentHash, CanonicalAst ast, SymbolTable symbols,
                        FlowGraphs flowGraphs, DataFlow dataFlow) {
        List<AstNode> nodes = new ArrayList<>(ast.nodes());
        for (AstNode synthetic : flowGraphs.syntheticNodes()) {
            if (synthetic.id() != nodes.size()) {
                fail(identity, "synthetic node " + synthetic.id() + " out of sequence, expected " + nodes.size());
            }
            nodes.add(synthetic);
        }

        List<Edge> edges = new ArrayList<>();
        // 1. Syntax tree
        for (AstNode node : nodes) {
            if (node.parent() >= 0) edges.add(new Edge(EdgeKind.CHILD, node.parent(), node.id(), null));
        }
        // 2. Control flow between statement items
        for (ControlFlowGraph graph : flowGraphs.graphs()) {
            for (StatementEdge edge : graph.statementEdges()) {
                edges.add(new Edge(EdgeKind.CONTROL_FLOW, edge.fromNode(), edge.toNode(), edge.label().text()));
            }
        }
        // 3. Scope nesting and declarations
        for (Scope scope : symbols.scopes()) {
            if (scope.parent() >= 0) {
                edges.add(new Edge(EdgeKind.SCOPE, symbols.scope(scope.parent()).ownerNode(), scope.ownerNode(),
                    "nested"));
            }
            for (int symbolId : scope.symbols()) {
                edges.add(new Edge(EdgeKind.SCOPE, scope.ownerNode(), symbols.symbol(symbolId).declNode(), "declares"));
            }
        }
        // 4. Bindings, defs and uses against the declaring occurrence
        Map<Integer, Integer> bindings = new TreeMap<>(symbols.bindings());
        for (Map.Entry<Integer, Integer> binding : bindings.entrySet()) {
            int occurrence = binding.getKey();
            Symbol symbol = symbols.symbol(binding.getValue());
            if (symbol.declNode() == occurrence) continue;
            edges.add(new Edge(EdgeKind.BINDING, occurrence, symbol.declNode(), null));
            AccessMode mode = symbols.accessOf(occurrence);
            if (mode == null) continue;
            if (mode.defines()) edges.add(new Edge(EdgeKind.DEF, occurrence, symbol.declNode(), null));
            if (mode.uses()) edges.add(new Edge(EdgeKind.USE, occurrence, symbol.declNode(), null));
        }
        // 5. Reaching definitions
        for (DefUse pair : dataFlow.reachingDefs()) {
            edges.add(new Edge(EdgeKind.REACHING_DEF, pair.defNode(), pair.useNode(), null));
        }

        for (Edge edge : edges) {
            if (edge.from() < 0 || edge.from() >= nodes.size() || edge.to() < 0 || edge.to() >= nodes.size()) {
                fail(identity, edge.kind() + " edge " + edge.from() + " -> " + edge.to() + " references a missing node");
            }
        }
        return new Asg(identity, contentHash, ast, nodes, edges, symbols, flowGraphs, dataFlow);
    }

    private static void fail(String identity, String message) {
        System.err.println("[asg-engine] inconsistent graph for " + identity + ": " + message);
        throw new InconsistentGraphException(identity, message);
    }

    /**
     * An edge or node id does not line up with the node arena. Fatal to the build that raised it.
     */
    public static class InconsistentGraphException extends RuntimeException {
        private final String identity;

        public InconsistentGraphException(String identity, String message) {
            super("Inconsistent graph for " + identity + ": " + message);
            this.identity = identity;
        }

        public String getIdentity() { return identity; }
    }
}
