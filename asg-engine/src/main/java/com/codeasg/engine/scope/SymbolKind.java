package com.codeasg.engine.scope;

public enum SymbolKind {
    VARIABLE,
    PARAMETER,
    FUNCTION,
    CLASS,
    IMPORT
}
