package com.codeasg.engine.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Control-flow graph of one function or of a unit's top-level code.
 */
public final class ControlFlowGraph {

    public static final int ENTRY = 0;
    public static final int EXIT = 1;

    private final int functionNode;
    private final int entryNode;
    private final int exitNode;
    private final List<BasicBlock> blocks;
    private final List<CfgEdge> edges;
    private final Set<Integer> headerOnly;
    private final Map<Integer, List<CfgEdge>> successors = new HashMap<>();
    private final Map<Integer, List<CfgEdge>> predecessors = new HashMap<>();
    private final Map<Integer, Integer> blockOfItem = new HashMap<>();

    ControlFlowGraph(int functionNode, int entryNode, int exitNode, List<BasicBlock> blocks, List<CfgEdge> edges,
                     Set<Integer> headerOnly) {
        this.functionNode = functionNode;
        this.entryNode = entryNode;
        this.exitNode = exitNode;
        this.blocks = List.copyOf(blocks);
        this.edges = List.copyOf(edges);
        this.headerOnly = Set.copyOf(headerOnly);
        for (CfgEdge edge : this.edges) {
            successors.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
            predecessors.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
        }
        for (BasicBlock block : this.blocks) {
            for (int item : block.items()) blockOfItem.put(item, block.id());
        }
    }

    /** The function-like node (or module root) this graph belongs to. */
    public int functionNode() { return functionNode; }

    public int entryNode() { return entryNode; }

    public int exitNode() { return exitNode; }

    public List<BasicBlock> blocks() { return blocks; }

    public BasicBlock block(int id) { return blocks.get(id); }

    public List<CfgEdge> edges() { return edges; }

    public List<CfgEdge> successors(int block) {
        return successors.getOrDefault(block, Collections.emptyList());
    }

    public List<CfgEdge> predecessors(int block) {
        return predecessors.getOrDefault(block, Collections.emptyList());
    }

    /** True if the item stands for the head of a compound statement only. */
    public boolean isHeaderOnly(int item) {
        return headerOnly.contains(item);
    }

    /** Block holding the item, or -1. */
    public int blockOf(int item) {
        return blockOfItem.getOrDefault(item, -1);
    }

    /**
     * Item-level edges: consecutive items inside a block are joined by {@code seq}; across
     * blocks the last item of the source joins the first item of the target with the block
     * edge's label. Empty blocks are passed through to the nearest blocks with items.
     */
    public List<StatementEdge> statementEdges() {
        List<StatementEdge> result = new ArrayList<>();
        for (BasicBlock block : blocks) {
            List<Integer> items = block.items();
            for (int i = 0; i + 1 < items.size(); i++) {
                result.add(new StatementEdge(items.get(i), items.get(i + 1), FlowLabel.SEQ));
            }
        }
        Set<StatementEdge> crossing = new LinkedHashSet<>();
        for (CfgEdge edge : edges) {
            BasicBlock from = blocks.get(edge.from());
            if (from.isEmpty()) continue;
            for (Map.Entry<Integer, FlowLabel> target : nonEmptyTargets(edge).entrySet()) {
                crossing.add(new StatementEdge(from.last(), blocks.get(target.getKey()).first(), target.getValue()));
            }
        }
        result.addAll(crossing);
        return result;
    }

    /**
     * Blocks with items that {@code edge} leads to, passing through empty blocks. The label
     * is the edge's own unless a later hop carries one that names where control goes.
     */
    private Map<Integer, FlowLabel> nonEmptyTargets(CfgEdge edge) {
        Map<Integer, FlowLabel> found = new LinkedHashMap<>();
        BitSet visited = new BitSet();
        Deque<CfgEdge> work = new ArrayDeque<>();
        work.add(edge);
        visited.set(edge.to());
        while (!work.isEmpty()) {
            CfgEdge current = work.poll();
            if (!blocks.get(current.to()).isEmpty()) {
                found.putIfAbsent(current.to(), current.label());
                continue;
            }
            for (CfgEdge next : successors(current.to())) {
                if (visited.get(next.to())) continue;
                visited.set(next.to());
                FlowLabel label = next.label().dominatesFold() ? next.label() : current.label();
                work.add(new CfgEdge(edge.from(), next.to(), label));
            }
        }
        return found;
    }
}
