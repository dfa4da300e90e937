package com.codeasg.engine.scope;

/**
 * How an identifier occurrence touches its variable.
 */
public enum AccessMode {
    READ,
    WRITE,
    READ_WRITE,
    /** Declared without a value; not a definition. */
    DECLARE,
    /** Declared and given a value at the same point. */
    DECLARE_INIT;

    public boolean defines() {
        return this == WRITE || this == READ_WRITE || this == DECLARE_INIT;
    }

    public boolean uses() {
        return this == READ || this == READ_WRITE;
    }
}
