package com.codeasg.engine.query;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.ByteRange;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.ast.Role;
import com.codeasg.engine.graph.Asg;
import com.codeasg.engine.graph.Edge;
import com.codeasg.engine.graph.EdgeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only traversals over an assembled {@link Asg}. Stateless; any number of queries may
 * run concurrently against the same graph.
 */
public class QueryEngine {

    private static final int CHECK_INTERVAL = 256;

    public QueryResult query(Asg asg, QuerySpec spec) {
        return query(asg, spec, QueryOptions.defaults());
    }

    public QueryResult query(Asg asg, QuerySpec spec, QueryOptions options) {
        Run run = new Run(asg, options);
        switch (spec.kind()) {
            case FIND_BY_KIND -> run.findByKind(spec.kinds(), spec.range());
            case ANCESTORS -> run.ancestors(run.start(spec.node()));
            case DESCENDANTS -> run.descendants(run.start(spec.node()));
            case CONTROL_SUCC -> run.control(run.start(spec.node()), true);
            case CONTROL_PRED -> run.control(run.start(spec.node()), false);
            case SLICE -> run.slice(run.start(spec.node()), spec.direction());
            case CALL_SITES -> run.callSites(spec.symbol());
        }
        return run.result();
    }

    private static final class Run {
        private final Asg asg;
        private final int maxResults;
        private final long deadline;
        private final List<AstNode> results = new ArrayList<>();
        private final BitSet emitted = new BitSet();
        private boolean degraded;
        private boolean truncated;
        private int steps;

        Run(Asg asg, QueryOptions options) {
            this.asg = asg;
            this.maxResults = options.maxResults();
            this.deadline = System.nanoTime() + options.timeout().toNanos();
        }

        int start(int node) {
            if (!asg.hasNode(node)) {
                throw new IllegalArgumentException("Unknown node id " + node + " in " + asg.identity());
            }
            if (asg.touchesError(asg.node(node))) degraded = true;
            return node;
        }

        QueryResult result() {
            return new QueryResult(results, degraded, truncated);
        }

        /** False once the result bound is reached. */
        private boolean emit(int id) {
            tick();
            if (emitted.get(id)) return true;
            if (results.size() >= maxResults) {
                truncated = true;
                return false;
            }
            emitted.set(id);
            AstNode node = asg.node(id);
            results.add(node);
            if (asg.touchesError(node)) degraded = true;
            return true;
        }

        private void tick() {
            if (steps++ % CHECK_INTERVAL != 0) return;
            if (Thread.currentThread().isInterrupted()) throw new QueryCancelledException();
            if (System.nanoTime() - deadline > 0) throw new QueryTimeoutException();
        }

        void findByKind(Set<String> kinds, ByteRange range) {
            for (AstNode node : asg.nodes()) {
                tick();
                if (range != null && !range.contains(node.range())) continue;
                boolean match = kinds.contains(node.tag())
                    || kinds.contains(node.kind().tag())
                    || (node.rawKind() != null && kinds.contains(node.rawKind()));
                if (match && !emit(node.id())) return;
            }
        }

        void ancestors(int node) {
            int current = node;
            while (true) {
                List<Edge> parents = asg.incoming(current, EdgeKind.CHILD);
                if (parents.isEmpty()) return;
                current = parents.get(0).from();
                if (!emit(current)) return;
            }
        }

        void descendants(int node) {
            Deque<Integer> work = new ArrayDeque<>();
            pushChildren(work, node);
            while (!work.isEmpty()) {
                int current = work.pop();
                if (!emit(current)) return;
                pushChildren(work, current);
            }
        }

        private void pushChildren(Deque<Integer> work, int node) {
            List<Edge> children = asg.outgoing(node, EdgeKind.CHILD);
            for (int i = children.size() - 1; i >= 0; i--) work.push(children.get(i).to());
        }

        void control(int node, boolean forward) {
            int anchor = controlAnchor(node);
            if (anchor < 0) return;
            BitSet visited = new BitSet();
            visited.set(anchor);
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(anchor);
            while (!queue.isEmpty()) {
                int current = queue.poll();
                List<Edge> next = forward
                    ? asg.outgoing(current, EdgeKind.CONTROL_FLOW)
                    : asg.incoming(current, EdgeKind.CONTROL_FLOW);
                for (Edge edge : next) {
                    int target = forward ? edge.to() : edge.from();
                    if (visited.get(target)) continue;
                    visited.set(target);
                    if (!emit(target)) return;
                    queue.add(target);
                }
            }
        }

        /** Nearest node, walking up the syntax tree, that takes part in control flow. */
        private int controlAnchor(int node) {
            int current = node;
            while (current >= 0) {
                if (!asg.outgoing(current, EdgeKind.CONTROL_FLOW).isEmpty()
                    || !asg.incoming(current, EdgeKind.CONTROL_FLOW).isEmpty()) {
                    return current;
                }
                List<Edge> parents = asg.incoming(current, EdgeKind.CHILD);
                current = parents.isEmpty() ? -1 : parents.get(0).from();
            }
            return -1;
        }

        void slice(int node, QuerySpec.Direction direction) {
            boolean backward = direction == QuerySpec.Direction.BACKWARD;
            Map<Integer, List<Integer>> occurrencesByItem = new HashMap<>();
            for (Map.Entry<Integer, Integer> entry : asg.dataFlow().itemOf().entrySet()) {
                occurrencesByItem.computeIfAbsent(entry.getValue(), k -> new ArrayList<>()).add(entry.getKey());
            }
            BitSet visited = new BitSet();
            Deque<Integer> work = new ArrayDeque<>();
            List<Integer> seeds = seeds(node, backward, occurrencesByItem);
            for (int seed : seeds) {
                visited.set(seed);
                work.add(seed);
            }
            for (int seed : seeds) {
                if (!expandWithinItem(seed, backward, occurrencesByItem, visited, work)) return;
            }
            while (!work.isEmpty()) {
                int current = work.poll();
                List<Edge> chain = backward
                    ? asg.incoming(current, EdgeKind.REACHING_DEF)
                    : asg.outgoing(current, EdgeKind.REACHING_DEF);
                for (Edge edge : chain) {
                    int reached = backward ? edge.from() : edge.to();
                    if (visited.get(reached)) continue;
                    visited.set(reached);
                    if (!emit(reached)) return;
                    if (!expandWithinItem(reached, backward, occurrencesByItem, visited, work)) return;
                    work.add(reached);
                }
            }
        }

        /**
         * Flow inside one statement: backward, a def depends on the uses evaluated with it;
         * forward, a use feeds the defs evaluated with it. False once the result bound is reached.
         */
        private boolean expandWithinItem(int occurrence, boolean backward, Map<Integer, List<Integer>> occurrencesByItem,
                                         BitSet visited, Deque<Integer> work) {
            Set<Integer> own = backward ? asg.dataFlow().defs() : asg.dataFlow().uses();
            if (!own.contains(occurrence)) return true;
            Set<Integer> wanted = backward ? asg.dataFlow().uses() : asg.dataFlow().defs();
            Integer item = asg.dataFlow().itemOf().get(occurrence);
            for (int sibling : occurrencesByItem.getOrDefault(item, List.of())) {
                if (!wanted.contains(sibling) || visited.get(sibling)) continue;
                visited.set(sibling);
                if (!emit(sibling)) return false;
                work.add(sibling);
            }
            return true;
        }

        /**
         * Occurrences the slice starts from: the node itself when it is an occurrence,
         * otherwise the uses (backward) or defs (forward) beneath it or evaluated with it.
         */
        private List<Integer> seeds(int node, boolean backward, Map<Integer, List<Integer>> occurrencesByItem) {
            List<Integer> seeds = new ArrayList<>();
            if (asg.dataFlow().itemOf().containsKey(node)) {
                seeds.add(node);
                return seeds;
            }
            Set<Integer> wanted = backward ? asg.dataFlow().uses() : asg.dataFlow().defs();
            for (int occurrence : occurrencesByItem.getOrDefault(node, List.of())) {
                if (wanted.contains(occurrence)) seeds.add(occurrence);
            }
            ByteRange range = asg.node(node).range();
            for (int occurrence : asg.dataFlow().itemOf().keySet()) {
                if (wanted.contains(occurrence) && !seeds.contains(occurrence)
                    && range.contains(asg.node(occurrence).range())) {
                    seeds.add(occurrence);
                }
            }
            seeds.sort(null);
            return seeds;
        }

        void callSites(int symbol) {
            if (symbol < 0 || symbol >= asg.symbols().symbols().size()) {
                throw new IllegalArgumentException("Unknown symbol id " + symbol + " in " + asg.identity());
            }
            for (AstNode node : asg.ast().nodes()) {
                tick();
                if (node.kind() != CanonicalKind.CALL_EXPR) continue;
                if (calleeBindsTo(node, symbol) && !emit(node.id())) return;
            }
        }

        private boolean calleeBindsTo(AstNode call, int symbol) {
            AstNode callee = asg.ast().child(call, Role.CALLEE);
            if (callee == null) return false;
            if (Integer.valueOf(symbol).equals(asg.symbols().bindingOf(callee.id()))) return true;
            if (callee.kind() == CanonicalKind.MEMBER_EXPR) {
                AstNode member = asg.ast().child(callee, Role.MEMBER);
                return member != null && Integer.valueOf(symbol).equals(asg.symbols().bindingOf(member.id()));
            }
            return false;
        }
    }

    /** The query ran past its deadline. No state to undo; queries are read-only. */
    public static class QueryTimeoutException extends RuntimeException {
        public QueryTimeoutException() {
            super("Query exceeded its deadline");
        }
    }

    /** The querying thread was interrupted. */
    public static class QueryCancelledException extends RuntimeException {
        public QueryCancelledException() {
            super("Query cancelled");
        }
    }
}
