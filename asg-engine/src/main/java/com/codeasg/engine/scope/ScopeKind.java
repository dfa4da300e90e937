package com.codeasg.engine.scope;

public enum ScopeKind {
    MODULE,
    FUNCTION,
    CLASS,
    BLOCK
}
