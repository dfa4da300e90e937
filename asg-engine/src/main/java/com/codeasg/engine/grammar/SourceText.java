package com.codeasg.engine.grammar;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Immutable source text with its UTF-8 encoding; all node ranges are byte offsets into {@link #bytes()}.
 */
public final class SourceText {

    private final String text;
    private final byte[] utf8;

    private SourceText(String text) {
        this.text = text;
        this.utf8 = text.getBytes(StandardCharsets.UTF_8);
    }

    public static SourceText of(String text) {
        return new SourceText(text != null ? text : "");
    }

    public String text() { return text; }

    public int byteLength() { return utf8.length; }

    public byte[] bytes() { return Arrays.copyOf(utf8, utf8.length); }

    /** Decodes the byte range [start, end), clamped to the text. */
    public String slice(int startByte, int endByte) {
        int start = Math.max(0, Math.min(startByte, utf8.length));
        int end = Math.max(start, Math.min(endByte, utf8.length));
        return new String(utf8, start, end - start, StandardCharsets.UTF_8);
    }

    /** Row and byte column just past the last byte. */
    public TextPoint endPoint() {
        int row = 0;
        int lineStart = 0;
        for (int i = 0; i < utf8.length; i++) {
            if (utf8[i] == '\n') {
                row++;
                lineStart = i + 1;
            }
        }
        return new TextPoint(row, utf8.length - lineStart);
    }

    /** Byte at offset, or -1 outside the text. */
    public int byteAt(int offset) {
        return offset >= 0 && offset < utf8.length ? utf8[offset] & 0xff : -1;
    }
}
