package com.codeasg.engine;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.ast.Role;
import com.codeasg.engine.grammar.Language;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstNormalizerTest {

    @Test
    void rootIsModuleSpanningTheUnit() {
        String source = "x = 1\nprint(x)\n";
        CanonicalAst ast = Units.parse(source, Language.PYTHON);
        AstNode root = ast.root();
        assertEquals(CanonicalKind.MODULE, root.kind());
        assertEquals("module", root.rawKind());
        assertEquals(-1, root.parent());
        assertEquals(0, root.startByte());
        assertEquals(source.length(), root.endByte());
        assertFalse(ast.hasErrors());
    }

    @Test
    void everyNodeIsContainedInItsParent() {
        for (Language language : new Language[] {Language.PYTHON, Language.JAVASCRIPT, Language.GO}) {
            String source = switch (language) {
                case PYTHON -> Units.fixture("inventory.py");
                case JAVASCRIPT -> Units.fixture("cart.js");
                default -> Units.fixture("queue.go");
            };
            CanonicalAst ast = Units.parse(source, language);
            for (AstNode node : ast.nodes()) {
                if (node.parent() < 0) continue;
                AstNode parent = ast.node(node.parent());
                assertTrue(parent.range().contains(node.range()),
                    language + ": node " + node.id() + " escapes its parent " + parent.id());
                assertTrue(parent.children().contains(node.id()));
                assertTrue(node.id() > parent.id(), "ids are assigned in pre-order");
            }
        }
    }

    @Test
    void assignmentsCarryTheirOperator() {
        CanonicalAst ast = Units.parse("x = 1\nx += 2\n", Language.PYTHON);
        List<AstNode> assignments = Units.nodes(ast, CanonicalKind.ASSIGNMENT);
        assertEquals(2, assignments.size());
        assertEquals("=", assignments.get(0).operator());
        assertFalse(assignments.get(0).isAugmented());
        assertEquals("+=", assignments.get(1).operator());
        assertTrue(assignments.get(1).isAugmented());
    }

    @Test
    void declarationKeywordIsKept() {
        CanonicalAst ast = Units.parse("let a = 1;\nconst b = a;\n", Language.JAVASCRIPT);
        List<AstNode> declarations = Units.nodes(ast, CanonicalKind.VARIABLE_DECL);
        assertEquals(2, declarations.size());
        assertEquals("let", declarations.get(0).keyword());
        assertEquals("const", declarations.get(1).keyword());
    }

    @Test
    void fieldsBecomeRoles() {
        CanonicalAst ast = Units.parse("if (a) { b(); } else { c(); }\n", Language.JAVASCRIPT);
        AstNode ifStmt = Units.first(ast, CanonicalKind.IF_STMT);
        assertNotNull(ast.child(ifStmt, Role.CONDITION));
        assertNotNull(ast.child(ifStmt, Role.THEN));
        AstNode alternative = ast.child(ifStmt, Role.ELSE);
        assertNotNull(alternative);
        assertEquals(CanonicalKind.ELSE_CLAUSE, alternative.kind());

        AstNode call = Units.first(ast, CanonicalKind.CALL_EXPR);
        AstNode callee = ast.child(call, Role.CALLEE);
        assertEquals("b", ast.text(callee));
    }

    @Test
    void unmappedKindsKeepTheirRawKind() {
        CanonicalAst ast = Units.parse("x = {'a': 1}\n", Language.PYTHON);
        AstNode dictionary = ast.nodes().stream()
            .filter(n -> "dictionary".equals(n.rawKind()))
            .findFirst()
            .orElseThrow();
        assertEquals(CanonicalKind.OTHER, dictionary.kind());
        assertEquals("Other(dictionary)", dictionary.tag());
    }

    @Test
    void missingBraceBecomesErrorNode() {
        String source = "function f(a) {\n  let b = a + 1;\n  return b;\n";
        CanonicalAst ast = Units.parse(source, Language.JAVASCRIPT);
        assertTrue(ast.hasErrors());
        List<AstNode> errors = Units.nodes(ast, CanonicalKind.ERROR);
        assertFalse(errors.isEmpty());
        int bodyStart = source.indexOf('{');
        assertTrue(errors.stream().anyMatch(e -> e.endByte() > bodyStart),
            "an error region should cover the unterminated body");
        assertFalse(ast.errors().isEmpty());
    }

    @Test
    void textIsSlicedByUtf8Bytes() {
        String source = "s = \"héllo\"\nt = s\n";
        CanonicalAst ast = Units.parse(source, Language.PYTHON);
        List<AstNode> ts = Units.identifiers(ast, "t");
        assertEquals(1, ts.size());
        assertEquals("t", ast.text(ts.get(0)));
        assertEquals(source.getBytes(java.nio.charset.StandardCharsets.UTF_8).length, ast.root().endByte());
    }
}
