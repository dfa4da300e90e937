package com.codeasg.engine;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.cfg.BasicBlock;
import com.codeasg.engine.cfg.CfgBuilder;
import com.codeasg.engine.cfg.CfgEdge;
import com.codeasg.engine.cfg.ControlFlowGraph;
import com.codeasg.engine.cfg.FlowGraphs;
import com.codeasg.engine.cfg.FlowLabel;
import com.codeasg.engine.cfg.StatementEdge;
import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.graph.Asg;
import com.codeasg.engine.query.QueryEngine;
import com.codeasg.engine.query.QueryResult;
import com.codeasg.engine.query.QuerySpec;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CfgBuilderTest {

    private static ControlFlowGraph graphOf(CanonicalAst ast, FlowGraphs flows, CanonicalKind kind) {
        AstNode function = Units.first(ast, kind);
        ControlFlowGraph graph = flows.forFunction(function.id());
        assertNotNull(graph, "no graph for " + kind);
        return graph;
    }

    private static List<BasicBlock> realBlocks(ControlFlowGraph graph) {
        return graph.blocks().stream().filter(b -> !b.synthetic()).collect(Collectors.toList());
    }

    private static boolean hasEdge(ControlFlowGraph graph, int from, int to, FlowLabel label) {
        return graph.successors(from).stream().anyMatch(e -> e.to() == to && e.label() == label);
    }

    @Test
    void ifElseProducesHeaderBranchesAndMerge() {
        CanonicalAst ast = Units.parse(
            "function f(x, y) {\n  if (x) { y = 1; } else { y = 2; }\n  return y;\n}\n", Language.JAVASCRIPT);
        FlowGraphs flows = new CfgBuilder().build(ast);
        ControlFlowGraph graph = graphOf(ast, flows, CanonicalKind.FUNCTION_DECL);

        assertEquals(4, realBlocks(graph).size());
        int header = graph.blockOf(Units.first(ast, CanonicalKind.IF_STMT).id());
        int merge = graph.blockOf(Units.first(ast, CanonicalKind.RETURN_STMT).id());
        List<AstNode> statements = Units.nodes(ast, CanonicalKind.EXPR_STMT);
        int thenBlock = graph.blockOf(statements.get(0).id());
        int elseBlock = graph.blockOf(statements.get(1).id());

        assertTrue(hasEdge(graph, header, thenBlock, FlowLabel.TRUE));
        assertTrue(hasEdge(graph, header, elseBlock, FlowLabel.FALSE));
        assertTrue(hasEdge(graph, thenBlock, merge, FlowLabel.SEQ));
        assertTrue(hasEdge(graph, elseBlock, merge, FlowLabel.SEQ));
        assertTrue(hasEdge(graph, merge, ControlFlowGraph.EXIT, FlowLabel.RETURN));
    }

    @Test
    void whileLoopHasLoopBackEdge() {
        CanonicalAst ast = Units.parse("def f(n):\n    while n > 0:\n        n -= 1\n    return n\n", Language.PYTHON);
        FlowGraphs flows = new CfgBuilder().build(ast);
        ControlFlowGraph graph = graphOf(ast, flows, CanonicalKind.FUNCTION_DECL);
        int header = graph.blockOf(Units.first(ast, CanonicalKind.WHILE_STMT).id());
        int body = graph.blockOf(Units.first(ast, CanonicalKind.EXPR_STMT).id());
        int after = graph.blockOf(Units.first(ast, CanonicalKind.RETURN_STMT).id());
        assertTrue(hasEdge(graph, header, body, FlowLabel.TRUE));
        assertTrue(hasEdge(graph, body, header, FlowLabel.LOOP_BACK));
        assertTrue(hasEdge(graph, header, after, FlowLabel.FALSE));
    }

    @Test
    void codeAfterReturnIsTaggedUnreachable() {
        CanonicalAst ast = Units.parse("function f() {\n  return 1;\n  foo();\n}\n", Language.JAVASCRIPT);
        FlowGraphs flows = new CfgBuilder().build(ast);
        ControlFlowGraph graph = graphOf(ast, flows, CanonicalKind.FUNCTION_DECL);
        int dead = graph.blockOf(Units.first(ast, CanonicalKind.EXPR_STMT).id());
        assertTrue(graph.block(dead).unreachable());
        assertFalse(graph.block(ControlFlowGraph.EXIT).unreachable());
        int live = graph.blockOf(Units.first(ast, CanonicalKind.RETURN_STMT).id());
        assertFalse(graph.block(live).unreachable());
    }

    @Test
    void cSwitchFallsThroughBetweenCases() {
        CanonicalAst ast = Units.parse(
            "int g(int n) {\n  int r = 0;\n  switch (n) {\n  case 1:\n    r = 1;\n  case 2:\n    r = 2;\n    break;\n"
                + "  default:\n    r = 3;\n  }\n  return r;\n}\n", Language.C);
        FlowGraphs flows = new CfgBuilder().build(ast);
        ControlFlowGraph graph = graphOf(ast, flows, CanonicalKind.FUNCTION_DECL);
        List<AstNode> cases = Units.nodes(ast, CanonicalKind.CASE_CLAUSE);
        assertEquals(3, cases.size());
        int header = graph.blockOf(Units.first(ast, CanonicalKind.SWITCH_STMT).id());
        for (AstNode clause : cases) {
            assertTrue(hasEdge(graph, header, graph.blockOf(clause.id()), FlowLabel.CASE));
        }
        assertTrue(hasEdge(graph, graph.blockOf(cases.get(0).id()), graph.blockOf(cases.get(1).id()), FlowLabel.SEQ));
        assertFalse(graph.successors(header).stream().anyMatch(e -> e.label() == FlowLabel.FALSE),
            "a switch with a default has no fall-out edge");
    }

    @Test
    void raiseInsideTryReachesHandler() {
        CanonicalAst ast = Units.parse(
            "def f(x):\n    try:\n        if x:\n            raise ValueError()\n        y = 1\n"
                + "    except ValueError:\n        y = 2\n    finally:\n        print(x)\n    return y\n",
            Language.PYTHON);
        FlowGraphs flows = new CfgBuilder().build(ast);
        ControlFlowGraph graph = graphOf(ast, flows, CanonicalKind.FUNCTION_DECL);
        int raise = graph.blockOf(Units.first(ast, CanonicalKind.THROW_STMT).id());
        int handler = graph.blockOf(Units.first(ast, CanonicalKind.CATCH_CLAUSE).id());
        assertTrue(hasEdge(graph, raise, handler, FlowLabel.EXCEPTION));
        assertFalse(graph.block(handler).unreachable());
        int cleanup = graph.blockOf(Units.find(ast, CanonicalKind.EXPR_STMT, "print").id());
        assertFalse(graph.block(cleanup).unreachable());
    }

    @Test
    void rustLabeledBreakLeavesOuterLoop() {
        CanonicalAst ast = Units.parse(Units.fixture("stack.rs"), Language.RUST);
        FlowGraphs flows = new CfgBuilder().build(ast);
        AstNode countdown = Units.find(ast, CanonicalKind.FUNCTION_DECL, "pub fn countdown");
        ControlFlowGraph graph = flows.forFunction(countdown.id());
        AstNode labeled = Units.find(ast, CanonicalKind.BREAK_STMT, "break 'outer");
        int breakBlock = graph.blockOf(labeled.id());
        assertTrue(breakBlock >= 0);
        List<CfgEdge> out = graph.successors(breakBlock);
        assertEquals(1, out.size());
        BasicBlock target = graph.block(out.get(0).to());
        AstNode outerLoop = Units.find(ast, CanonicalKind.WHILE_STMT, "'outer");
        assertFalse(target.items().contains(outerLoop.id()), "break must leave the loop, not restart it");
        assertFalse(target.unreachable());
    }

    private static Set<Integer> itemsReachedFromEntry(ControlFlowGraph graph) {
        Set<Integer> reached = new HashSet<>();
        Deque<Integer> work = new ArrayDeque<>();
        work.add(graph.entryNode());
        reached.add(graph.entryNode());
        List<StatementEdge> edges = graph.statementEdges();
        while (!work.isEmpty()) {
            int current = work.poll();
            for (StatementEdge edge : edges) {
                if (edge.fromNode() == current && reached.add(edge.toNode())) work.add(edge.toNode());
            }
        }
        return reached;
    }

    @Test
    void emptyTryBodyKeepsStatementFlowConnected() {
        CanonicalAst ast = Units.parse("function f() {\n  try { } catch (e) { g(); }\n  h();\n}\n",
            Language.JAVASCRIPT);
        ControlFlowGraph graph = graphOf(ast, new CfgBuilder().build(ast), CanonicalKind.FUNCTION_DECL);
        Set<Integer> reached = itemsReachedFromEntry(graph);
        assertTrue(reached.contains(Units.find(ast, CanonicalKind.EXPR_STMT, "h()").id()));
        assertTrue(reached.contains(Units.first(ast, CanonicalKind.CATCH_CLAUSE).id()));
        assertTrue(reached.contains(graph.exitNode()));
        assertTrue(graph.statementEdges().stream().anyMatch(e ->
            e.fromNode() == graph.entryNode() && e.label() == FlowLabel.EXCEPTION),
            "the exception edge out of the empty body keeps its label");
    }

    @Test
    void passOnlyTryBodyKeepsStatementFlowConnected() {
        CanonicalAst ast = Units.parse(
            "def f():\n    try:\n        pass\n    except Exception:\n        g()\n    h()\n", Language.PYTHON);
        ControlFlowGraph graph = graphOf(ast, new CfgBuilder().build(ast), CanonicalKind.FUNCTION_DECL);
        Set<Integer> reached = itemsReachedFromEntry(graph);
        assertTrue(reached.contains(Units.find(ast, CanonicalKind.EXPR_STMT, "h()").id()));
        assertTrue(reached.contains(Units.find(ast, CanonicalKind.EXPR_STMT, "g()").id()));
        assertTrue(reached.contains(graph.exitNode()));

        Asg asg = Units.build(ast.source().text(), Language.PYTHON);
        AstNode entry = asg.node(graph.entryNode());
        assertEquals(CanonicalKind.CFG_ENTRY, entry.kind());
        QueryResult successors = new QueryEngine().query(asg, QuerySpec.controlSucc(entry.id()));
        assertTrue(successors.ids().contains(Units.find(asg.ast(), CanonicalKind.EXPR_STMT, "h()").id()));
    }

    @Test
    void everyGraphHasOneEntryAndOneExitAndHonestReachability() {
        String[][] fixtures = {
            {"inventory.py", "python"}, {"cart.js", "javascript"}, {"shapes.ts", "typescript"},
            {"queue.go", "go"}, {"stack.rs", "rust"}, {"buffer.c", "c"}, {"matrix.cpp", "cpp"},
            {"Ledger.java", "java"}
        };
        for (String[] fixture : fixtures) {
            CanonicalAst ast = Units.parse(Units.fixture(fixture[0]), Language.fromId(fixture[1]));
            FlowGraphs flows = new CfgBuilder().build(ast);
            for (ControlFlowGraph graph : flows.graphs()) {
                String where = fixture[0] + " graph of node " + graph.functionNode();
                long synthetic = graph.blocks().stream().filter(BasicBlock::synthetic).count();
                assertEquals(2, synthetic, where);
                assertEquals(List.of(graph.entryNode()), graph.block(ControlFlowGraph.ENTRY).items(), where);
                assertEquals(List.of(graph.exitNode()), graph.block(ControlFlowGraph.EXIT).items(), where);
                assertTrue(graph.predecessors(ControlFlowGraph.ENTRY).isEmpty(), where);
                assertTrue(graph.successors(ControlFlowGraph.EXIT).isEmpty(), where);

                boolean[] reached = new boolean[graph.blocks().size()];
                Deque<Integer> work = new ArrayDeque<>();
                work.add(ControlFlowGraph.ENTRY);
                reached[ControlFlowGraph.ENTRY] = true;
                while (!work.isEmpty()) {
                    for (CfgEdge edge : graph.successors(work.poll())) {
                        if (!reached[edge.to()]) {
                            reached[edge.to()] = true;
                            work.add(edge.to());
                        }
                    }
                }
                for (BasicBlock block : graph.blocks()) {
                    assertEquals(!reached[block.id()], block.unreachable(), where + " block " + block.id());
                }
                assertTrue(reached[ControlFlowGraph.EXIT], where + ": exit unreachable");
            }
        }
    }
}
