package com.codeasg.engine.graph;

/**
 * Directed, kinded edge between two node ids.
 *
 * @param label  control-flow label ("seq", "true", ...) or scope label ("nested", "declares"); null otherwise
 */
public record Edge(EdgeKind kind, int from, int to, String label) {}
