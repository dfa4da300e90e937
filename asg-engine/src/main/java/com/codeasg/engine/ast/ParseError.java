package com.codeasg.engine.ast;

import com.codeasg.engine.grammar.TextPoint;

/**
 * A syntax error region recovered by the tolerant parser. Data, not an exception.
 */
public record ParseError(int startByte, int endByte, TextPoint start, String message) {

    public ByteRange range() {
        return new ByteRange(startByte, endByte);
    }
}
