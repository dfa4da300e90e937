package com.codeasg.engine.graph;

public enum EdgeKind {
    CHILD,
    CONTROL_FLOW,
    DEF,
    USE,
    REACHING_DEF,
    SCOPE,
    BINDING
}
