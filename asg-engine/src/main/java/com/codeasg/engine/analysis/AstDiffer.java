package com.codeasg.engine.analysis;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.ByteRange;
import com.codeasg.engine.ast.CanonicalAst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Locates the edited region between two parses of the same unit and the new-tree nodes it touches.
 */
public class AstDiffer {

    public AstDiff diff(CanonicalAst before, CanonicalAst after) {
        if (before.language() != after.language()) {
            throw new IllegalArgumentException("Cannot diff " + before.language() + " against " + after.language());
        }
        byte[] old = before.source().bytes();
        byte[] updated = after.source().bytes();

        // 1. Common prefix and suffix, the suffix never reaching into the prefix
        int prefix = 0;
        int shorter = Math.min(old.length, updated.length);
        while (prefix < shorter && old[prefix] == updated[prefix]) prefix++;
        if (prefix == old.length && prefix == updated.length) {
            return new AstDiff(null, List.of());
        }
        int suffix = 0;
        while (suffix < shorter - prefix
            && old[old.length - 1 - suffix] == updated[updated.length - 1 - suffix]) {
            suffix++;
        }
        ByteRange changed = new ByteRange(prefix, updated.length - suffix);

        // 2. Outermost nodes inside the change; a node only straddling it is replaced by its children
        List<AstNode> nodes = new ArrayList<>();
        Deque<AstNode> work = new ArrayDeque<>();
        work.push(after.root());
        while (!work.isEmpty()) {
            AstNode node = work.pop();
            if (changed.length() > 0 && changed.contains(node.range())) {
                nodes.add(node);
                continue;
            }
            List<AstNode> overlapping = new ArrayList<>();
            for (AstNode child : after.children(node)) {
                if (child.range().overlaps(changed)) overlapping.add(child);
            }
            if (overlapping.isEmpty()) {
                nodes.add(node);
                continue;
            }
            for (int i = overlapping.size() - 1; i >= 0; i--) work.push(overlapping.get(i));
        }
        return new AstDiff(changed, nodes);
    }
}
