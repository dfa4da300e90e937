package com.codeasg.engine;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.graph.Asg;
import com.codeasg.engine.query.QueryEngine;
import com.codeasg.engine.query.QueryEngine.QueryCancelledException;
import com.codeasg.engine.query.QueryEngine.QueryTimeoutException;
import com.codeasg.engine.query.QueryOptions;
import com.codeasg.engine.query.QueryResult;
import com.codeasg.engine.query.QuerySpec;
import com.codeasg.engine.scope.Symbol;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QueryEngineTest {

    private static final String SOURCE = String.join("\n",
        "function helper(v) {",
        "  return v * 2;",
        "}",
        "function f(x, y) {",
        "  if (x) { y = 1; } else { y = 2; }",
        "  return helper(y);",
        "}",
        "helper(3);",
        "");

    private static Asg asg;
    private static CanonicalAst ast;
    private static final QueryEngine engine = new QueryEngine();

    @BeforeAll
    static void build() {
        asg = Units.build(SOURCE, Language.JAVASCRIPT, "query.js");
        ast = asg.ast();
    }

    @Test
    void findByKindMatchesCanonicalTags() {
        QueryResult calls = engine.query(asg, QuerySpec.findByKind("CallExpr"));
        assertEquals(2, calls.size());
        assertFalse(calls.degraded());
        assertFalse(calls.truncated());

        AstNode f = Units.find(ast, CanonicalKind.FUNCTION_DECL, "function f");
        QueryResult inF = engine.query(asg, QuerySpec.findByKind(Set.of("CallExpr"), f.range()));
        assertEquals(1, inF.size());
        assertTrue(ast.text(inF.nodes().get(0)).startsWith("helper(y)"));

        QueryResult raw = engine.query(asg, QuerySpec.findByKind("if_statement"));
        assertEquals(1, raw.size());
    }

    @Test
    void ancestorsAreNearestFirstAndEndAtTheRoot() {
        AstNode one = Units.find(ast, CanonicalKind.LITERAL, "1");
        QueryResult result = engine.query(asg, QuerySpec.ancestors(one.id()));
        assertEquals(one.parent(), result.ids().get(0));
        assertEquals(ast.root().id(), result.ids().get(result.size() - 1));
        assertFalse(result.ids().contains(one.id()));
    }

    @Test
    void descendantsArePreOrder() {
        AstNode f = Units.find(ast, CanonicalKind.FUNCTION_DECL, "function f");
        QueryResult result = engine.query(asg, QuerySpec.descendants(f.id()));
        assertEquals(f.id(), result.nodes().get(0).parent());
        assertFalse(result.ids().contains(f.id()));
        AstNode ret = Units.find(ast, CanonicalKind.RETURN_STMT, "return helper");
        AstNode ifStmt = Units.first(ast, CanonicalKind.IF_STMT);
        assertTrue(result.ids().contains(ret.id()));
        assertTrue(result.ids().indexOf(ifStmt.id()) < result.ids().indexOf(ret.id()));
        for (AstNode node : result.nodes()) {
            assertTrue(f.range().contains(node.range()));
        }
    }

    @Test
    void controlSuccessorsAndPredecessors() {
        AstNode ifStmt = Units.first(ast, CanonicalKind.IF_STMT);
        AstNode ret = Units.find(ast, CanonicalKind.RETURN_STMT, "return helper");
        List<AstNode> assignments = Units.nodes(ast, CanonicalKind.EXPR_STMT).subList(0, 2);

        QueryResult succ = engine.query(asg, QuerySpec.controlSucc(ifStmt.id()));
        assertTrue(succ.ids().contains(ret.id()));
        assertTrue(succ.ids().contains(assignments.get(0).id()));
        assertTrue(succ.ids().contains(assignments.get(1).id()));
        assertFalse(succ.ids().contains(ifStmt.id()));
        assertTrue(succ.nodes().stream().anyMatch(n -> n.kind() == CanonicalKind.CFG_EXIT));

        QueryResult pred = engine.query(asg, QuerySpec.controlPred(ret.id()));
        assertTrue(pred.ids().contains(ifStmt.id()));
        assertTrue(pred.nodes().stream().anyMatch(n -> n.kind() == CanonicalKind.CFG_ENTRY));
        assertFalse(pred.ids().contains(ret.id()));
    }

    @Test
    void backwardSliceFindsBothDefinitions() {
        AstNode ret = Units.find(ast, CanonicalKind.RETURN_STMT, "return helper");
        List<AstNode> ys = Units.identifiers(ast, "y");
        QueryResult slice = engine.query(asg, QuerySpec.slice(ret.id(), QuerySpec.Direction.BACKWARD));
        assertTrue(slice.ids().containsAll(List.of(ys.get(1).id(), ys.get(2).id())));
        assertFalse(slice.ids().contains(ys.get(0).id()), "the parameter is overwritten on both paths");
    }

    @Test
    void forwardSliceFollowsUses() {
        List<AstNode> xs = Units.identifiers(ast, "x");
        QueryResult slice = engine.query(asg, QuerySpec.slice(xs.get(0).id(), QuerySpec.Direction.FORWARD));
        assertEquals(List.of(xs.get(1).id()), slice.ids());
    }

    @Test
    void slicesFromASingleOccurrenceIncludeItsOwnStatement() {
        Asg chain = Units.build("def f(a):\n    b = a + 1\n    c = b * 2\n    return c\n", Language.PYTHON, "chain.py");
        CanonicalAst chainAst = chain.ast();
        List<AstNode> as = Units.identifiers(chainAst, "a");
        List<AstNode> bs = Units.identifiers(chainAst, "b");
        List<AstNode> cs = Units.identifiers(chainAst, "c");

        QueryResult fromDef = engine.query(chain, QuerySpec.slice(cs.get(0).id(), QuerySpec.Direction.BACKWARD));
        assertTrue(fromDef.ids().containsAll(List.of(bs.get(1).id(), bs.get(0).id(), as.get(1).id(), as.get(0).id())),
            "backward from c reaches what c was computed from");
        assertFalse(fromDef.ids().contains(cs.get(1).id()));

        QueryResult fromStatement = engine.query(chain,
            QuerySpec.slice(Units.find(chainAst, CanonicalKind.EXPR_STMT, "c =").id(), QuerySpec.Direction.BACKWARD));
        assertTrue(fromDef.ids().containsAll(fromStatement.ids()));

        QueryResult fromUse = engine.query(chain, QuerySpec.slice(bs.get(1).id(), QuerySpec.Direction.FORWARD));
        assertTrue(fromUse.ids().containsAll(List.of(cs.get(0).id(), cs.get(1).id())),
            "forward from the use of b reaches c and its use");
        assertFalse(fromUse.ids().contains(as.get(1).id()));
    }

    @Test
    void callSitesOfAFunction() {
        Symbol helper = asg.symbols().symbols().stream()
            .filter(s -> s.name().equals("helper"))
            .findFirst()
            .orElseThrow();
        QueryResult calls = engine.query(asg, QuerySpec.callSites(helper.id()));
        assertEquals(2, calls.size());
        for (AstNode call : calls.nodes()) assertEquals(CanonicalKind.CALL_EXPR, call.kind());

        assertThrows(IllegalArgumentException.class, () -> engine.query(asg, QuerySpec.callSites(-1)));
    }

    @Test
    void resultsAreBoundedAndFlaggedTruncated() {
        QueryResult result = engine.query(asg, QuerySpec.findByKind("Identifier"),
            new QueryOptions(2, Duration.ofSeconds(5)));
        assertEquals(2, result.size());
        assertTrue(result.truncated());
    }

    @Test
    void unknownNodeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> engine.query(asg, QuerySpec.ancestors(asg.size())));
    }

    @Test
    void interruptedThreadCancelsTheQuery() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(QueryCancelledException.class,
                () -> engine.query(asg, QuerySpec.findByKind("Identifier")));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void expiredDeadlineTimesOut() {
        StringBuilder source = new StringBuilder();
        for (int i = 0; i < 2000; i++) source.append("a = a + ").append(i).append('\n');
        Asg large = Units.build(source.toString(), Language.PYTHON, "large.py");
        assertThrows(QueryTimeoutException.class,
            () -> engine.query(large, QuerySpec.findByKind("Identifier"), new QueryOptions(100_000, Duration.ofNanos(1))));
    }

    @Test
    void queriesTouchingBrokenSyntaxAreDegraded() {
        Asg broken = Units.build("function g(a) {\n  if (a {\n    return 1;\n  }\n}\n", Language.JAVASCRIPT, "broken.js");
        assertTrue(broken.isDegraded());
        QueryResult errors = engine.query(broken, QuerySpec.findByKind("Error"));
        assertFalse(errors.isEmpty());
        assertTrue(errors.degraded());

        QueryResult clean = engine.query(asg, QuerySpec.findByKind("FunctionDecl"));
        assertFalse(clean.degraded());
    }
}
