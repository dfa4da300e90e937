package com.codeasg.engine.ast;

import com.codeasg.engine.grammar.TextPoint;

import java.util.List;

/**
 * One node of a canonical AST. Ids are dense pre-order indexes; the root is 0.
 *
 * @param rawKind   grammar node kind this node was produced from; null for synthetic CFG nodes
 * @param parent    parent id, or -1 for the root
 * @param children  child ids in source order
 * @param operator  operator token text for assignments and updates ("=", "+=", "++"), else null
 * @param keyword   declaration keyword such as "let", "const" or "var", else null
 */
public record AstNode(
    int id,
    CanonicalKind kind,
    String rawKind,
    Role role,
    int parent,
    List<Integer> children,
    int startByte,
    int endByte,
    TextPoint start,
    TextPoint end,
    String operator,
    String keyword
) {

    public AstNode {
        children = List.copyOf(children);
    }

    /** Canonical tag; unmapped kinds render as {@code Other(raw_kind)}. */
    public String tag() {
        return kind == CanonicalKind.OTHER ? "Other(" + rawKind + ")" : kind.tag();
    }

    public ByteRange range() {
        return new ByteRange(startByte, endByte);
    }

    public boolean is(CanonicalKind expected) {
        return kind == expected;
    }

    public boolean isAugmented() {
        return operator != null && !operator.equals("=") && !operator.equals(":=");
    }
}
