package com.codeasg.engine.query;

import com.codeasg.engine.ast.ByteRange;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A query over one ASG. Closed set of shapes, built through the static factories.
 */
public final class QuerySpec {

    public enum Kind { FIND_BY_KIND, ANCESTORS, DESCENDANTS, CONTROL_SUCC, CONTROL_PRED, SLICE, CALL_SITES }

    public enum Direction { FORWARD, BACKWARD }

    private final Kind kind;
    private final Set<String> kinds;
    private final ByteRange range;
    private final int node;
    private final Direction direction;
    private final int symbol;

    private QuerySpec(Kind kind, Set<String> kinds, ByteRange range, int node, Direction direction, int symbol) {
        this.kind = kind;
        this.kinds = kinds;
        this.range = range;
        this.node = node;
        this.direction = direction;
        this.symbol = symbol;
    }

    /**
     * Nodes whose canonical tag or raw grammar kind is in {@code kinds}.
     *
     * @param range  when non-null, only nodes inside this byte range
     */
    public static QuerySpec findByKind(Set<String> kinds, ByteRange range) {
        Objects.requireNonNull(kinds, "kinds");
        return new QuerySpec(Kind.FIND_BY_KIND, Collections.unmodifiableSet(new LinkedHashSet<>(kinds)), range, -1, null, -1);
    }

    public static QuerySpec findByKind(String... kinds) {
        return findByKind(Set.of(kinds), null);
    }

    public static QuerySpec ancestors(int node) {
        return new QuerySpec(Kind.ANCESTORS, Set.of(), null, node, null, -1);
    }

    public static QuerySpec descendants(int node) {
        return new QuerySpec(Kind.DESCENDANTS, Set.of(), null, node, null, -1);
    }

    public static QuerySpec controlSucc(int node) {
        return new QuerySpec(Kind.CONTROL_SUCC, Set.of(), null, node, null, -1);
    }

    public static QuerySpec controlPred(int node) {
        return new QuerySpec(Kind.CONTROL_PRED, Set.of(), null, node, null, -1);
    }

    public static QuerySpec slice(int node, Direction direction) {
        return new QuerySpec(Kind.SLICE, Set.of(), null, node, Objects.requireNonNull(direction, "direction"), -1);
    }

    public static QuerySpec callSites(int symbol) {
        return new QuerySpec(Kind.CALL_SITES, Set.of(), null, -1, null, symbol);
    }

    public Kind kind() { return kind; }

    public Set<String> kinds() { return kinds; }

    public ByteRange range() { return range; }

    public int node() { return node; }

    public Direction direction() { return direction; }

    public int symbol() { return symbol; }

    @Override
    public String toString() {
        switch (kind) {
            case FIND_BY_KIND: return "find_by_kind" + kinds + (range == null ? "" : " in " + range);
            case SLICE: return "slice(" + node + ", " + direction.name().toLowerCase() + ")";
            case CALL_SITES: return "call_sites(" + symbol + ")";
            default: return kind.name().toLowerCase() + "(" + node + ")";
        }
    }
}
