package com.codeasg.engine.cfg;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.AstShapes;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.ast.CanonicalKind;
import com.codeasg.engine.ast.Role;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Visits the nodes one statement item evaluates, in evaluation order: VALUE children before
 * their siblings, nested functions and class bodies excluded. A header-only item (the
 * head of an if, loop, switch, try or catch) excludes the statements it governs.
 */
public final class ItemWalker {

    private static final Set<Role> GOVERNED_ROLES = EnumSet.of(
        Role.BODY, Role.THEN, Role.ELSE, Role.HANDLER, Role.FINALIZER, Role.UPDATE);

    private ItemWalker() {}

    public static void walk(CanonicalAst ast, AstNode item, boolean headerOnly, Consumer<AstNode> visitor) {
        if (headerOnly) {
            visitor.accept(item);
            for (AstNode child : ordered(ast, headerChildren(ast, item))) visit(ast, child, visitor);
        } else {
            visit(ast, item, visitor);
        }
    }

    /** Children of a header-only item that belong to the header itself. */
    public static List<AstNode> headerChildren(CanonicalAst ast, AstNode node) {
        List<AstNode> result = new ArrayList<>();
        if (node.kind() == CanonicalKind.CASE_CLAUSE) {
            List<AstNode> statements = AstShapes.statements(ast, node);
            for (AstNode child : ast.children(node)) {
                if (!statements.contains(child)) result.add(child);
            }
            return result;
        }
        if (node.kind() == CanonicalKind.LABELED_STMT) return result;
        boolean forLoop = node.kind() == CanonicalKind.FOR_STMT;
        for (AstNode child : ast.children(node)) {
            if (GOVERNED_ROLES.contains(child.role())) continue;
            if (forLoop && (child.role() == Role.INIT || child.role() == Role.CONDITION)) continue;
            if (forLoop && child.kind() == CanonicalKind.LOOP_CLAUSE) continue;
            CanonicalKind kind = child.kind();
            if (kind.isCompound() && kind != CanonicalKind.WITH_STMT) continue;
            result.add(child);
        }
        return result;
    }

    private static void visit(CanonicalAst ast, AstNode node, Consumer<AstNode> visitor) {
        visitor.accept(node);
        CanonicalKind kind = node.kind();
        if (kind == CanonicalKind.LAMBDA) return;
        if (kind == CanonicalKind.FUNCTION_DECL || kind == CanonicalKind.CLASS_DECL) {
            AstNode name = kind == CanonicalKind.FUNCTION_DECL
                ? AstShapes.declaredName(ast, node)
                : ast.child(node, Role.NAME);
            if (name != null) visitor.accept(name);
            return;
        }
        for (AstNode child : ordered(ast, ast.children(node))) visit(ast, child, visitor);
    }

    private static List<AstNode> ordered(CanonicalAst ast, List<AstNode> children) {
        List<AstNode> values = new ArrayList<>();
        List<AstNode> rest = new ArrayList<>();
        for (AstNode child : children) {
            if (child.role() == Role.VALUE) values.add(child);
            else rest.add(child);
        }
        values.addAll(rest);
        return values;
    }
}
