package com.codeasg.engine.graph;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.ByteRange;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.ParseError;
import com.codeasg.engine.cfg.FlowGraphs;
import com.codeasg.engine.dfg.DataFlow;
import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.scope.SymbolTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The assembled graph of one source unit: AST nodes plus synthetic CFG nodes in one id space,
 * and every edge layered over them. Immutable; safe to share between threads.
 */
public final class Asg {

    private final String identity;
    private final String contentHash;
    private final CanonicalAst ast;
    private final List<AstNode> nodes;
    private final List<Edge> edges;
    private final SymbolTable symbols;
    private final FlowGraphs flowGraphs;
    private final DataFlow dataFlow;
    private final List<ByteRange> errorRanges;
    private final Map<EdgeKind, List<List<Edge>>> outgoing = new EnumMap<>(EdgeKind.class);
    private final Map<EdgeKind, List<List<Edge>>> incoming = new EnumMap<>(EdgeKind.class);

    Asg(String identity, String contentHash, CanonicalAst ast, List<AstNode> nodes, List<Edge> edges,
        SymbolTable symbols, FlowGraphs flowGraphs, DataFlow dataFlow) {
        this.identity = identity;
        this.contentHash = contentHash;
        this.ast = ast;
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.symbols = symbols;
        this.flowGraphs = flowGraphs;
        this.dataFlow = dataFlow;
        List<ByteRange> ranges = new ArrayList<>();
        for (ParseError error : ast.errors()) ranges.add(error.range());
        this.errorRanges = List.copyOf(ranges);
        for (EdgeKind kind : EdgeKind.values()) {
            outgoing.put(kind, emptyIndex(this.nodes.size()));
            incoming.put(kind, emptyIndex(this.nodes.size()));
        }
        for (Edge edge : this.edges) {
            outgoing.get(edge.kind()).get(edge.from()).add(edge);
            incoming.get(edge.kind()).get(edge.to()).add(edge);
        }
    }

    private static List<List<Edge>> emptyIndex(int size) {
        List<List<Edge>> index = new ArrayList<>(size);
        for (int i = 0; i < size; i++) index.add(new ArrayList<>(2));
        return index;
    }

    public String identity() { return identity; }

    public String contentHash() { return contentHash; }

    public Language language() { return ast.language(); }

    public CanonicalAst ast() { return ast; }

    public List<AstNode> nodes() { return nodes; }

    public AstNode node(int id) { return nodes.get(id); }

    public boolean hasNode(int id) { return id >= 0 && id < nodes.size(); }

    public int size() { return nodes.size(); }

    public List<Edge> edges() { return edges; }

    public List<Edge> outgoing(int node, EdgeKind kind) {
        return Collections.unmodifiableList(outgoing.get(kind).get(node));
    }

    public List<Edge> incoming(int node, EdgeKind kind) {
        return Collections.unmodifiableList(incoming.get(kind).get(node));
    }

    public SymbolTable symbols() { return symbols; }

    public FlowGraphs flowGraphs() { return flowGraphs; }

    public DataFlow dataFlow() { return dataFlow; }

    public List<ParseError> parseErrors() { return ast.errors(); }

    public List<ByteRange> errorRanges() { return errorRanges; }

    /** True when the unit had syntax errors; the graph is partial but queryable. */
    public boolean isDegraded() { return ast.hasErrors(); }

    public boolean touchesError(AstNode node) {
        ByteRange range = node.range();
        for (ByteRange error : errorRanges) {
            if (error.overlaps(range)) return true;
        }
        return false;
    }

    public String text(AstNode node) {
        return ast.source().slice(node.startByte(), node.endByte());
    }
}
