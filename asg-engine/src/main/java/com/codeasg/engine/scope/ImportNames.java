package com.codeasg.engine.scope;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.ast.Role;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the local names an import statement binds.
 */
final class ImportNames {

    record ImportedName(String name, AstNode node) {}

    private ImportNames() {}

    static List<ImportedName> of(CanonicalAst ast, AstNode node) {
        List<ImportedName> names = new ArrayList<>();
        switch (ast.language()) {
            case PYTHON -> python(ast, node, names);
            case JAVASCRIPT, TYPESCRIPT -> javascript(ast, node, names);
            case JAVA -> java(ast, node, names);
            case GO -> go(ast, node, names);
            case RUST -> rust(ast, node, names);
            case CPP -> cpp(ast, node, names);
            case C -> { }
        }
        return names;
    }

    private static void python(CanonicalAst ast, AstNode node, List<ImportedName> names) {
        boolean fromImport = node.rawKind().equals("import_from_statement");
        for (AstNode child : ast.children(node, Role.NAME)) {
            if (child.rawKind().equals("aliased_import")) {
                add(ast, ast.child(child, Role.ALIAS), names);
            } else if (child.rawKind().equals("dotted_name")) {
                List<AstNode> parts = ast.children(child, CanonicalKind.IDENTIFIER);
                if (!parts.isEmpty()) add(ast, fromImport ? parts.get(parts.size() - 1) : parts.get(0), names);
            } else if (child.kind() == CanonicalKind.IDENTIFIER) {
                add(ast, child, names);
            }
        }
    }

    private static void javascript(CanonicalAst ast, AstNode node, List<ImportedName> names) {
        for (AstNode child : ast.children(node)) {
            switch (child.rawKind()) {
                case "import_clause", "named_imports", "namespace_import" -> javascript(ast, child, names);
                case "import_specifier" -> {
                    AstNode alias = ast.child(child, Role.ALIAS);
                    add(ast, alias != null ? alias : ast.child(child, Role.NAME), names);
                }
                case "identifier" -> add(ast, child, names);
                default -> { }
            }
        }
    }

    private static void java(CanonicalAst ast, AstNode node, List<ImportedName> names) {
        if (ast.text(node).contains("*")) return;
        AstNode current = lastNamed(ast, node);
        while (current != null && current.rawKind().equals("scoped_identifier")) {
            current = ast.child(current, Role.NAME);
        }
        if (current != null && current.kind() == CanonicalKind.IDENTIFIER) add(ast, current, names);
    }

    private static void go(CanonicalAst ast, AstNode node, List<ImportedName> names) {
        for (AstNode child : ast.children(node)) {
            if (child.rawKind().equals("import_spec_list")) {
                go(ast, child, names);
            } else if (child.rawKind().equals("import_spec")) {
                AstNode alias = ast.child(child, Role.NAME);
                if (alias != null) {
                    String text = ast.text(alias);
                    if (!text.equals("_") && !text.equals(".")) names.add(new ImportedName(text, alias));
                    continue;
                }
                String path = ast.text(child).trim().replace("\"", "").replace("`", "");
                int slash = path.lastIndexOf('/');
                String name = slash >= 0 ? path.substring(slash + 1) : path;
                if (!name.isEmpty()) names.add(new ImportedName(name, child));
            }
        }
    }

    private static void rust(CanonicalAst ast, AstNode node, List<ImportedName> names) {
        for (AstNode child : ast.children(node)) {
            rustUseTree(ast, child, names);
        }
    }

    private static void rustUseTree(CanonicalAst ast, AstNode node, List<ImportedName> names) {
        switch (node.rawKind()) {
            case "identifier" -> add(ast, node, names);
            case "scoped_identifier" -> add(ast, lastIdentifier(ast, node), names);
            case "use_as_clause" -> add(ast, ast.child(node, Role.ALIAS), names);
            case "scoped_use_list", "use_list" -> {
                for (AstNode child : ast.children(node)) {
                    if (node.rawKind().equals("scoped_use_list") && !child.rawKind().equals("use_list")) continue;
                    rustUseTree(ast, child, names);
                }
            }
            default -> { }
        }
    }

    private static void cpp(CanonicalAst ast, AstNode node, List<ImportedName> names) {
        if (!node.rawKind().equals("using_declaration") || ast.text(node).startsWith("using namespace")) return;
        AstNode target = lastNamed(ast, node);
        if (target == null) return;
        add(ast, target.kind() == CanonicalKind.IDENTIFIER ? target : lastIdentifier(ast, target), names);
    }

    private static AstNode lastNamed(CanonicalAst ast, AstNode node) {
        List<AstNode> children = ast.children(node);
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    private static AstNode lastIdentifier(CanonicalAst ast, AstNode node) {
        List<AstNode> parts = ast.children(node, CanonicalKind.IDENTIFIER);
        return parts.isEmpty() ? null : parts.get(parts.size() - 1);
    }

    private static void add(CanonicalAst ast, AstNode node, List<ImportedName> names) {
        if (node != null) names.add(new ImportedName(ast.text(node), node));
    }
}
