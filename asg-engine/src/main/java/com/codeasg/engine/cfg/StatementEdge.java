package com.codeasg.engine.cfg;

/**
 * Control-flow edge between two statement items, as projected into the graph.
 */
public record StatementEdge(int fromNode, int toNode, FlowLabel label) {}
