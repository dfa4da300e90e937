package com.codeasg.engine.grammar;

/**
 * Zero-based row and byte column inside a source text.
 */
public record TextPoint(int row, int column) implements Comparable<TextPoint> {

    public static final TextPoint ORIGIN = new TextPoint(0, 0);

    @Override
    public int compareTo(TextPoint other) {
        if (row != other.row) return Integer.compare(row, other.row);
        return Integer.compare(column, other.column);
    }
}
