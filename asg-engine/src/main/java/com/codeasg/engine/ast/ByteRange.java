package com.codeasg.engine.ast;

/**
 * Half-open byte range [start, end).
 */
public record ByteRange(int start, int end) {

    public ByteRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid byte range [" + start + ", " + end + ")");
        }
    }

    public boolean contains(ByteRange other) {
        return start <= other.start && other.end <= end;
    }

    /** Overlap test; a zero-width range overlaps a range that contains its position. */
    public boolean overlaps(ByteRange other) {
        if (start == end || other.start == other.end) {
            return start <= other.end && other.start <= end;
        }
        return start < other.end && other.start < end;
    }

    public int length() { return end - start; }
}
