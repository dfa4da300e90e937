package com.codeasg.engine.analysis;

import com.codeasg.engine.ast.AstNode;
import com.codeasg.engine.ast.ByteRange;

import java.util.List;

/**
 * Difference between two versions of a unit.
 *
 * @param changedRange  bytes of the new text that differ from the old text; null when identical
 * @param changedNodes  nodes of the new tree covering the change, outermost first
 */
public record AstDiff(ByteRange changedRange, List<AstNode> changedNodes) {

    public AstDiff {
        changedNodes = List.copyOf(changedNodes);
    }

    public boolean isUnchanged() {
        return changedRange == null;
    }
}
