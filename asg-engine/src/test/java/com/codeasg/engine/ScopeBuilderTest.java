package com.codeasg.engine;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.scope.AccessMode;
import com.codeasg.engine.scope.ScopeBuilder;
import com.codeasg.engine.scope.ScopeKind;
import com.codeasg.engine.scope.Symbol;
import com.codeasg.engine.scope.SymbolKind;
import com.codeasg.engine.scope.SymbolTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeBuilderTest {

    private static Symbol boundSymbol(SymbolTable table, AstNode occurrence) {
        Integer symbol = table.bindingOf(occurrence.id());
        assertNotNull(symbol, "occurrence at byte " + occurrence.startByte() + " is unbound");
        return table.symbol(symbol);
    }

    @Test
    void pythonParametersAndModuleNamesResolve() {
        CanonicalAst ast = Units.parse("x = 1\ndef f(a):\n    return a + x\nprint(f(2))\n", Language.PYTHON);
        SymbolTable table = new ScopeBuilder().build(ast);

        List<AstNode> as = Units.identifiers(ast, "a");
        Symbol parameter = boundSymbol(table, as.get(1));
        assertEquals(SymbolKind.PARAMETER, parameter.kind());
        assertEquals(as.get(0).id(), parameter.declNode());
        assertEquals(ScopeKind.FUNCTION, table.scope(parameter.scopeId()).kind());

        List<AstNode> xs = Units.identifiers(ast, "x");
        Symbol x = boundSymbol(table, xs.get(1));
        assertEquals(0, x.scopeId());
        assertEquals(xs.get(0).id(), x.declNode());
        assertEquals(List.of(xs.get(1).id()), x.uses());

        AstNode print = Units.identifiers(ast, "print").get(0);
        assertNull(table.bindingOf(print.id()));
        assertTrue(table.unresolved().contains(print.id()));
    }

    @Test
    void pythonGlobalDirectiveBindsToModuleSymbol() {
        CanonicalAst ast = Units.parse("count = 0\ndef bump():\n    global count\n    count += 1\n", Language.PYTHON);
        SymbolTable table = new ScopeBuilder().build(ast);
        List<AstNode> counts = Units.identifiers(ast, "count");
        AstNode update = counts.get(counts.size() - 1);
        Symbol symbol = boundSymbol(table, update);
        assertEquals(0, symbol.scopeId());
        assertEquals(counts.get(0).id(), symbol.declNode());
        assertEquals(AccessMode.READ_WRITE, table.accessOf(update.id()));
    }

    @Test
    void pythonClassAttributesAreNotVisibleInMethods() {
        CanonicalAst ast = Units.parse("class A:\n    size = 1\n    def get(self):\n        return size\n",
            Language.PYTHON);
        SymbolTable table = new ScopeBuilder().build(ast);
        List<AstNode> sizes = Units.identifiers(ast, "size");
        assertEquals(ScopeKind.CLASS, table.scope(boundSymbol(table, sizes.get(0)).scopeId()).kind());
        assertNull(table.bindingOf(sizes.get(1).id()));
    }

    @Test
    void javascriptLetIsBlockScoped() {
        CanonicalAst ast = Units.parse("let v = 1;\n{\n  let v = 2;\n  use(v);\n}\nuse(v);\n", Language.JAVASCRIPT);
        SymbolTable table = new ScopeBuilder().build(ast);
        List<AstNode> vs = Units.identifiers(ast, "v");
        assertEquals(4, vs.size());
        assertEquals(vs.get(1).id(), boundSymbol(table, vs.get(2)).declNode());
        assertEquals(vs.get(0).id(), boundSymbol(table, vs.get(3)).declNode());
        assertEquals(ScopeKind.BLOCK, table.scope(boundSymbol(table, vs.get(2)).scopeId()).kind());
    }

    @Test
    void javascriptVarIsHoistedToTheFunction() {
        CanonicalAst ast = Units.parse(
            "function f() {\n  if (true) {\n    var h = 1;\n  }\n  return h;\n}\n", Language.JAVASCRIPT);
        SymbolTable table = new ScopeBuilder().build(ast);
        List<AstNode> hs = Units.identifiers(ast, "h");
        Symbol h = boundSymbol(table, hs.get(1));
        assertEquals(hs.get(0).id(), h.declNode());
        assertEquals(ScopeKind.FUNCTION, table.scope(h.scopeId()).kind());
    }

    @Test
    void javascriptAssignmentToUndeclaredNameCreatesGlobal() {
        CanonicalAst ast = Units.parse("function g() { leaked = 1; }\nconsole.log(leaked);\n", Language.JAVASCRIPT);
        SymbolTable table = new ScopeBuilder().build(ast);
        List<AstNode> leaked = Units.identifiers(ast, "leaked");
        Symbol symbol = boundSymbol(table, leaked.get(0));
        assertEquals(0, symbol.scopeId());
        assertEquals(symbol.id(), boundSymbol(table, leaked.get(1)).id());
    }

    @Test
    void goShortVarRedeclarationReusesExistingVariable() {
        CanonicalAst ast = Units.parse(
            "package p\n\nfunc f() int {\n\tx := 1\n\tx, y := 2, 3\n\treturn x + y\n}\n", Language.GO);
        SymbolTable table = new ScopeBuilder().build(ast);
        List<AstNode> xs = Units.identifiers(ast, "x");
        assertEquals(3, xs.size());
        Symbol x = boundSymbol(table, xs.get(0));
        assertEquals(x.id(), boundSymbol(table, xs.get(1)).id());
        assertEquals(AccessMode.WRITE, table.accessOf(xs.get(1).id()));
        assertEquals(x.id(), boundSymbol(table, xs.get(2)).id());
        AstNode y = Units.identifiers(ast, "y").get(0);
        assertEquals(SymbolKind.VARIABLE, boundSymbol(table, y).kind());
    }

    @Test
    void cInnerDeclarationShadowsOnlyInsideItsBlock() {
        CanonicalAst ast = Units.parse(
            "int f(int a) {\n  int b = a;\n  {\n    int a = 2;\n    b = a;\n  }\n  return a + b;\n}\n", Language.C);
        SymbolTable table = new ScopeBuilder().build(ast);
        List<AstNode> as = Units.identifiers(ast, "a");
        assertEquals(5, as.size());
        Symbol parameter = boundSymbol(table, as.get(0));
        assertEquals(SymbolKind.PARAMETER, parameter.kind());
        assertEquals(parameter.id(), boundSymbol(table, as.get(1)).id());
        Symbol inner = boundSymbol(table, as.get(2));
        assertNotEquals(parameter.id(), inner.id());
        assertEquals(inner.id(), boundSymbol(table, as.get(3)).id());
        assertEquals(parameter.id(), boundSymbol(table, as.get(4)).id());
    }

    @Test
    void everyOccurrenceHasAtMostOneBindingAndItsSymbolExists() {
        CanonicalAst ast = Units.parse(Units.fixture("Ledger.java"), Language.JAVA);
        SymbolTable table = new ScopeBuilder().build(ast);
        for (var binding : table.bindings().entrySet()) {
            assertTrue(binding.getValue() >= 0 && binding.getValue() < table.symbols().size());
            assertFalse(table.unresolved().contains(binding.getKey()));
        }
        for (Symbol symbol : table.symbols()) {
            assertTrue(table.scope(symbol.scopeId()).symbols().contains(symbol.id()));
        }
    }
}
