package com.codeasg.engine.dfg;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.AstShapes;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.cfg.BasicBlock;
import com.codeasg.engine.cfg.CfgEdge;
import com.codeasg.engine.cfg.ControlFlowGraph;
import com.codeasg.engine.cfg.FlowGraphs;
import com.codeasg.engine.cfg.ItemWalker;
import com.codeasg.engine.scope.AccessMode;
import com.codeasg.engine.scope.Symbol;
import com.codeasg.engine.scope.SymbolKind;
import com.codeasg.engine.scope.SymbolTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes reaching definitions per control-flow graph with a forward may-analysis
 * over blocks. Variables are keyed by symbol; unresolved names are keyed by their text
 * within the function.
 */
public class DataFlowAnalyzer {

    public DataFlow analyze(CanonicalAst ast, SymbolTable symbols, FlowGraphs graphs) {
        Set<DefUse> pairs = new LinkedHashSet<>();
        Map<Integer, Integer> itemOf = new HashMap<>();
        Set<Integer> defs = new HashSet<>();
        Set<Integer> uses = new HashSet<>();
        for (ControlFlowGraph graph : graphs.graphs()) {
            new FunctionFlow(ast, symbols, graph, pairs, itemOf, defs, uses).run();
        }
        TreeSet<DefUse> ordered = new TreeSet<>((a, b) -> a.defNode() != b.defNode()
            ? Integer.compare(a.defNode(), b.defNode())
            : Integer.compare(a.useNode(), b.useNode()));
        ordered.addAll(pairs);
        return new DataFlow(new ArrayList<>(ordered), itemOf, defs, uses);
    }

    private record Event(int node, String key, boolean def) {}

    private static final class FunctionFlow {
        private final CanonicalAst ast;
        private final SymbolTable symbols;
        private final ControlFlowGraph graph;
        private final Set<DefUse> pairs;
        private final Map<Integer, Integer> itemOf;
        private final Set<Integer> defs;
        private final Set<Integer> uses;
        private final List<List<Event>> events = new ArrayList<>();
        private final List<Event> definitions = new ArrayList<>();
        private final Map<String, BitSet> defsByKey = new HashMap<>();

        FunctionFlow(CanonicalAst ast, SymbolTable symbols, ControlFlowGraph graph, Set<DefUse> pairs,
                     Map<Integer, Integer> itemOf, Set<Integer> defs, Set<Integer> uses) {
            this.ast = ast;
            this.symbols = symbols;
            this.graph = graph;
            this.pairs = pairs;
            this.itemOf = itemOf;
            this.defs = defs;
            this.uses = uses;
        }

        void run() {
            collectEvents();
            int blockCount = graph.blocks().size();
            BitSet[] gen = new BitSet[blockCount];
            BitSet[] kill = new BitSet[blockCount];
            Map<Event, Integer> defIndex = new HashMap<>();
            for (int i = 0; i < definitions.size(); i++) defIndex.put(definitions.get(i), i);
            for (int b = 0; b < blockCount; b++) {
                gen[b] = new BitSet();
                kill[b] = new BitSet();
                for (Event event : events.get(b)) {
                    if (!event.def()) continue;
                    BitSet sameKey = defsByKey.get(event.key());
                    gen[b].andNot(sameKey);
                    kill[b].or(sameKey);
                    gen[b].set(defIndex.get(event));
                }
            }

            BitSet[] in = new BitSet[blockCount];
            BitSet[] out = new BitSet[blockCount];
            for (int b = 0; b < blockCount; b++) {
                in[b] = new BitSet();
                out[b] = (BitSet) gen[b].clone();
            }
            Deque<Integer> worklist = new ArrayDeque<>();
            boolean[] queued = new boolean[blockCount];
            for (int b = 0; b < blockCount; b++) {
                worklist.add(b);
                queued[b] = true;
            }
            while (!worklist.isEmpty()) {
                int b = worklist.poll();
                queued[b] = false;
                BitSet incoming = new BitSet();
                for (CfgEdge edge : graph.predecessors(b)) incoming.or(out[edge.from()]);
                in[b] = incoming;
                BitSet result = (BitSet) incoming.clone();
                result.andNot(kill[b]);
                result.or(gen[b]);
                if (!result.equals(out[b])) {
                    out[b] = result;
                    for (CfgEdge edge : graph.successors(b)) {
                        if (!queued[edge.to()]) {
                            queued[edge.to()] = true;
                            worklist.add(edge.to());
                        }
                    }
                }
            }

            for (int b = 0; b < blockCount; b++) {
                BitSet reaching = (BitSet) in[b].clone();
                for (Event event : events.get(b)) {
                    BitSet sameKey = defsByKey.get(event.key());
                    if (event.def()) {
                        reaching.andNot(sameKey);
                        reaching.set(defIndex.get(event));
                        continue;
                    }
                    BitSet candidates = (BitSet) reaching.clone();
                    candidates.and(sameKey);
                    for (int d = candidates.nextSetBit(0); d >= 0; d = candidates.nextSetBit(d + 1)) {
                        pairs.add(new DefUse(definitions.get(d).node(), event.node()));
                    }
                }
            }
        }

        private void collectEvents() {
            for (BasicBlock block : graph.blocks()) {
                List<Event> blockEvents = new ArrayList<>();
                if (block.id() == ControlFlowGraph.ENTRY) {
                    parameterEvents(blockEvents);
                }
                for (int item : block.items()) {
                    if (item >= ast.size()) continue;
                    ItemWalker.walk(ast, ast.node(item), graph.isHeaderOnly(item), node -> {
                        AccessMode mode = symbols.accessOf(node.id());
                        if (mode == null || node.kind() != CanonicalKind.IDENTIFIER) return;
                        String key = keyOf(node);
                        if (mode.uses()) add(blockEvents, new Event(node.id(), key, false), item);
                        if (mode.defines()) add(blockEvents, new Event(node.id(), key, true), item);
                    });
                }
                events.add(blockEvents);
            }
        }

        private void parameterEvents(List<Event> blockEvents) {
            AstNode function = ast.node(graph.functionNode());
            if (!function.kind().isFunctionLike()) return;
            for (AstNode list : AstShapes.parameterLists(ast, function)) {
                Deque<AstNode> work = new ArrayDeque<>();
                work.push(list);
                while (!work.isEmpty()) {
                    AstNode node = work.pop();
                    Integer symbol = symbols.bindingOf(node.id());
                    if (node.kind() == CanonicalKind.IDENTIFIER && symbol != null) {
                        Symbol bound = symbols.symbol(symbol);
                        if (bound.kind() == SymbolKind.PARAMETER && bound.declNode() == node.id()) {
                            add(blockEvents, new Event(node.id(), keyOf(node), true), graph.entryNode());
                        }
                        continue;
                    }
                    for (int child : node.children()) work.push(ast.node(child));
                }
            }
        }

        private void add(List<Event> blockEvents, Event event, int item) {
            blockEvents.add(event);
            itemOf.put(event.node(), item);
            if (event.def()) {
                defsByKey.computeIfAbsent(event.key(), k -> new BitSet()).set(definitions.size());
                definitions.add(event);
                defs.add(event.node());
            } else {
                defsByKey.computeIfAbsent(event.key(), k -> new BitSet());
                uses.add(event.node());
            }
        }

        private String keyOf(AstNode occurrence) {
            Integer symbol = symbols.bindingOf(occurrence.id());
            if (symbol != null) return "#" + symbol;
            return ast.text(occurrence) + "@" + graph.functionNode();
        }
    }
}
