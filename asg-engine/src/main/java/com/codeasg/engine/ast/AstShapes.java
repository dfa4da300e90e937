package com.codeasg.engine.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural lookups shared by the scope, control-flow and data-flow builders.
 */
public final class AstShapes {

    private AstShapes() {}

    /**
     * Node naming a declaration: the NAME child, or for C-style declarators the identifier
     * at the end of the declarator chain. Null for anonymous functions and classes.
     */
    public static AstNode declaredName(CanonicalAst ast, AstNode node) {
        AstNode current = node;
        for (int depth = 0; current != null && depth < 32; depth++) {
            if (current.kind() == CanonicalKind.IDENTIFIER) return current;
            AstNode name = ast.child(current, Role.NAME);
            if (name != null) {
                if (name.kind() == CanonicalKind.IDENTIFIER || ast.child(name, Role.NAME) == null) return name;
                current = name;
                continue;
            }
            AstNode declarator = ast.child(current, Role.DECLARATOR);
            if (declarator == null && current.rawKind().endsWith("declarator")) {
                declarator = firstNamedIdentifierOrDeclarator(ast, current);
            }
            current = declarator;
        }
        return null;
    }

    private static AstNode firstNamedIdentifierOrDeclarator(CanonicalAst ast, AstNode node) {
        for (AstNode child : ast.children(node)) {
            if (child.role() == Role.PARAMETERS) continue;
            if (child.kind() == CanonicalKind.IDENTIFIER || child.rawKind().endsWith("declarator")) return child;
        }
        return null;
    }

    /** Parameter list nodes of a function, following C-style function declarators. */
    public static List<AstNode> parameterLists(CanonicalAst ast, AstNode function) {
        List<AstNode> lists = new ArrayList<>(ast.children(function, Role.PARAMETERS));
        if (!lists.isEmpty()) return lists;
        AstNode current = ast.child(function, Role.DECLARATOR);
        for (int depth = 0; current != null && depth < 32; depth++) {
            List<AstNode> found = ast.children(current, Role.PARAMETERS);
            if (!found.isEmpty()) return found;
            current = ast.child(current, Role.DECLARATOR);
        }
        return lists;
    }

    public static AstNode body(CanonicalAst ast, AstNode node) {
        return ast.child(node, Role.BODY);
    }

    /** Label attached to a jump or a labeled loop, without sigils ("'outer" and "outer:" become "outer"). */
    public static String labelText(CanonicalAst ast, AstNode node) {
        for (AstNode child : ast.children(node)) {
            if (child.role() == Role.LABEL || isLabelKind(child.rawKind())
                || (child.kind() == CanonicalKind.IDENTIFIER && labelsByIdentifier(node))) {
                return stripLabel(ast.text(child));
            }
        }
        return null;
    }

    /** Jumps and labeled statements whose label is written as a plain identifier child. */
    public static boolean labelsByIdentifier(AstNode node) {
        return node.kind() == CanonicalKind.BREAK_STMT
            || node.kind() == CanonicalKind.CONTINUE_STMT
            || node.kind() == CanonicalKind.LABELED_STMT;
    }

    public static boolean isLabelKind(String rawKind) {
        return rawKind.equals("label") || rawKind.equals("lifetime") || rawKind.equals("statement_identifier")
            || rawKind.equals("label_name") || rawKind.equals("loop_label");
    }

    private static String stripLabel(String text) {
        String label = text.trim();
        if (label.startsWith("'")) label = label.substring(1);
        if (label.endsWith(":")) label = label.substring(0, label.length() - 1);
        return label;
    }

    /** True for {@code this} or {@code self} receivers. */
    public static boolean isSelfReference(CanonicalAst ast, AstNode node) {
        if (node == null) return false;
        if (node.rawKind().equals("this") || node.rawKind().equals("self")) return true;
        if (node.kind() != CanonicalKind.IDENTIFIER) return false;
        String text = ast.text(node);
        return text.equals("self") || text.equals("this");
    }

    /** Statement or clause children of a case clause or block-like node, skipping its value/pattern. */
    public static List<AstNode> statements(CanonicalAst ast, AstNode node) {
        List<AstNode> result = new ArrayList<>();
        for (AstNode child : ast.children(node)) {
            Role role = child.role();
            if (role == Role.VALUE || role == Role.TARGET || role == Role.CONDITION || role == Role.LABEL) continue;
            if (child.kind() == CanonicalKind.IDENTIFIER && labelsByIdentifier(node)) continue;
            if (isLabelKind(child.rawKind()) || child.rawKind().equals("switch_label")
                || child.rawKind().equals("case_pattern") || child.rawKind().equals("if_clause")) continue;
            result.add(child);
        }
        return result;
    }
}
