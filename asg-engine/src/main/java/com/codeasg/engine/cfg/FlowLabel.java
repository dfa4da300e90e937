package com.codeasg.engine.cfg;

/**
 * Label carried by a control-flow edge.
 */
public enum FlowLabel {
    SEQ("seq"),
    TRUE("true"),
    FALSE("false"),
    LOOP_BACK("loop-back"),
    EXCEPTION("exception"),
    RETURN("return"),
    CASE("case");

    private final String text;

    FlowLabel(String text) {
        this.text = text;
    }

    public String text() { return text; }

    /** Labels that describe where control goes rather than why it left the previous block. */
    boolean dominatesFold() {
        return this == LOOP_BACK || this == RETURN || this == EXCEPTION;
    }

    @Override
    public String toString() { return text; }
}
