package com.codeasg.engine.ast;

import com.codeasg.engine.grammar.Language;
import com.codeasg.engine.grammar.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable canonical AST of one source unit. Node ids index {@link #nodes()} directly.
 */
public final class CanonicalAst {

    private final Language language;
    private final SourceText source;
    private final List<AstNode> nodes;
    private final List<ParseError> errors;

    public CanonicalAst(Language language, SourceText source, List<AstNode> nodes, List<ParseError> errors) {
        this.language = language;
        this.source = source;
        this.nodes = List.copyOf(nodes);
        this.errors = List.copyOf(errors);
    }

    public Language language() { return language; }

    public SourceText source() { return source; }

    public List<AstNode> nodes() { return nodes; }

    public List<ParseError> errors() { return errors; }

    public boolean hasErrors() { return !errors.isEmpty(); }

    public int size() { return nodes.size(); }

    public AstNode root() { return nodes.get(0); }

    public AstNode node(int id) { return nodes.get(id); }

    public AstNode parent(AstNode node) {
        return node.parent() >= 0 ? nodes.get(node.parent()) : null;
    }

    public List<AstNode> children(AstNode node) {
        List<AstNode> result = new ArrayList<>(node.children().size());
        for (int id : node.children()) result.add(nodes.get(id));
        return result;
    }

    /** First child playing {@code role}, or null. */
    public AstNode child(AstNode node, Role role) {
        for (int id : node.children()) {
            AstNode child = nodes.get(id);
            if (child.role() == role) return child;
        }
        return null;
    }

    public List<AstNode> children(AstNode node, Role role) {
        List<AstNode> result = new ArrayList<>();
        for (int id : node.children()) {
            AstNode child = nodes.get(id);
            if (child.role() == role) result.add(child);
        }
        return result;
    }

    /** First child of the given kind, or null. */
    public AstNode child(AstNode node, CanonicalKind kind) {
        for (int id : node.children()) {
            AstNode child = nodes.get(id);
            if (child.kind() == kind) return child;
        }
        return null;
    }

    public List<AstNode> children(AstNode node, CanonicalKind kind) {
        List<AstNode> result = new ArrayList<>();
        for (int id : node.children()) {
            AstNode child = nodes.get(id);
            if (child.kind() == kind) result.add(child);
        }
        return result;
    }

    public String text(AstNode node) {
        return source.slice(node.startByte(), node.endByte());
    }

    /** True if {@code ancestor} is {@code node} or one of its ancestors. */
    public boolean isWithin(AstNode node, AstNode ancestor) {
        AstNode current = node;
        while (current != null) {
            if (current.id() == ancestor.id()) return true;
            current = parent(current);
        }
        return false;
    }

    /** Nearest enclosing function-like node, or the root when the node sits at module level. */
    public AstNode enclosingFunction(AstNode node) {
        AstNode current = parent(node);
        while (current != null) {
            if (current.kind().isFunctionLike()) return current;
            current = parent(current);
        }
        return root();
    }
}
