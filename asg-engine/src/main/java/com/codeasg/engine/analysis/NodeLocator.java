package com.codeasg.engine.analysis;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.CanonicalAst;
import com.codeasg.engine.grammar.TextPoint;

import java.util.Optional;

/**
 * Finds the most specific node containing a position.
 */
public class NodeLocator {

    /**
     * @param row    0-based line
     * @param column 0-based column, in bytes
     * @return the deepest node whose start..end span (end inclusive) contains the position
     */
    public Optional<AstNode> nodeAt(CanonicalAst ast, int row, int column) {
        TextPoint position = new TextPoint(row, column);
        AstNode root = ast.root();
        if (!contains(root, position)) return Optional.empty();
        AstNode best = root;
        boolean descended = true;
        while (descended) {
            descended = false;
            AstNode match = null;
            for (AstNode child : ast.children(best)) {
                if (contains(child, position)) match = child;
            }
            if (match != null) {
                best = match;
                descended = true;
            }
        }
        return Optional.of(best);
    }

    private static boolean contains(AstNode node, TextPoint position) {
        return node.start().compareTo(position) <= 0 && position.compareTo(node.end()) <= 0;
    }
}
