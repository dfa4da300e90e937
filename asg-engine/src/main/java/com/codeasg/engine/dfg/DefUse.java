package com.codeasg.engine.dfg;

/**
 * A definition occurrence that may reach a use occurrence.
 */
public record DefUse(int defNode, int useNode) {}
