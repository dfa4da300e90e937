package com.codeasg.engine.analysis;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.AstShapes;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.ast.Role;
import com.codeasg.engine.cfg.BasicBlock;
import com.codeasg.engine.cfg.ControlFlowGraph;
import com.codeasg.engine.graph.Asg;
import com.codeasg.engine.scope.Scope;
import com.codeasg.engine.scope.Symbol;
import com.codeasg.engine.scope.SymbolKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts a {@link CodeStructure} outline from an assembled graph.
 */
public class StructureAnalyzer {

    private static final Set<CanonicalKind> NESTING = EnumSet.of(
        CanonicalKind.IF_STMT, CanonicalKind.WHILE_STMT, CanonicalKind.DO_WHILE_STMT, CanonicalKind.FOR_STMT,
        CanonicalKind.FOR_EACH_STMT, CanonicalKind.SWITCH_STMT, CanonicalKind.TRY_STMT, CanonicalKind.WITH_STMT);

    private static final Set<String> PATH_LITERALS = Set.of(
        "string", "string_literal", "interpreted_string_literal", "raw_string_literal", "system_lib_string");

    public CodeStructure analyze(Asg asg) {
        CanonicalAst ast = asg.ast();
        List<CodeStructure.FunctionInfo> functions = new ArrayList<>();
        List<CodeStructure.ClassInfo> classes = new ArrayList<>();
        List<CodeStructure.ImportInfo> imports = new ArrayList<>();

        for (AstNode node : ast.nodes()) {
            switch (node.kind()) {
                case FUNCTION_DECL -> functions.add(function(asg, node));
                case CLASS_DECL -> classes.add(new CodeStructure.ClassInfo(
                    nameOf(ast, node), line(node.start().row()), line(node.end().row())));
                case IMPORT -> imports.addAll(imports(ast, node));
                default -> { }
            }
        }
        return new CodeStructure(asg.language().id(), ast.source().text().length(), functions, classes, imports,
            ast.size(), maxNesting(ast));
    }

    private static CodeStructure.FunctionInfo function(Asg asg, AstNode node) {
        List<String> parameters = new ArrayList<>();
        for (Scope scope : asg.symbols().scopes()) {
            if (scope.ownerNode() != node.id()) continue;
            for (int symbolId : scope.symbols()) {
                Symbol symbol = asg.symbols().symbol(symbolId);
                if (symbol.kind() == SymbolKind.PARAMETER) parameters.add(symbol.name());
            }
        }
        int blocks = 0;
        int unreachable = 0;
        ControlFlowGraph graph = asg.flowGraphs().forFunction(node.id());
        if (graph != null) {
            blocks = graph.blocks().size();
            for (BasicBlock block : graph.blocks()) {
                if (block.unreachable()) unreachable++;
            }
        }
        return new CodeStructure.FunctionInfo(nameOf(asg.ast(), node), line(node.start().row()),
            line(node.end().row()), parameters, blocks, unreachable);
    }

    private static String nameOf(CanonicalAst ast, AstNode node) {
        AstNode name = AstShapes.declaredName(ast, node);
        return name == null ? "" : ast.text(name);
    }

    private static List<CodeStructure.ImportInfo> imports(CanonicalAst ast, AstNode node) {
        List<CodeStructure.ImportInfo> found = new ArrayList<>();
        List<AstNode> work = new ArrayList<>(ast.children(node));
        for (int i = 0; i < work.size(); i++) {
            AstNode current = work.get(i);
            if (PATH_LITERALS.contains(current.rawKind())) {
                found.add(new CodeStructure.ImportInfo(unquote(ast.text(current)), line(current.start().row())));
            } else {
                work.addAll(ast.children(current));
            }
        }
        if (found.isEmpty()) {
            String module = ast.text(node).trim();
            for (AstNode child : ast.children(node)) {
                if (child.role() != Role.ALIAS) {
                    module = ast.text(child);
                    break;
                }
            }
            found.add(new CodeStructure.ImportInfo(module, line(node.start().row())));
        }
        return found;
    }

    private static String unquote(String text) {
        String trimmed = text.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && "\"'`<".indexOf(trimmed.charAt(start)) >= 0) start++;
        while (end > start && "\"'`>".indexOf(trimmed.charAt(end - 1)) >= 0) end--;
        return trimmed.substring(start, end);
    }

    /** Deepest chain of nested branch, loop, try and with statements. */
    private static int maxNesting(CanonicalAst ast) {
        int[] depth = new int[ast.size()];
        int max = 0;
        for (AstNode node : ast.nodes()) {
            int inherited = node.parent() >= 0 ? depth[node.parent()] : 0;
            depth[node.id()] = NESTING.contains(node.kind()) ? inherited + 1 : inherited;
            max = Math.max(max, depth[node.id()]);
        }
        return max;
    }

    private static int line(int row) {
        return row + 1;
    }
}
